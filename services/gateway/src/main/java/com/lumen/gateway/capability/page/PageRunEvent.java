package com.lumen.gateway.capability.page;

/**
 * Item emitted while a page or section is generated. {@link #type()} becomes the SSE event name.
 */
public interface PageRunEvent {

    String type();

    record PageCreated(String id, String title) implements PageRunEvent {
        @Override
        public String type() {
            return "page-created";
        }
    }

    record PageContentDelta(String delta) implements PageRunEvent {
        @Override
        public String type() {
            return "page-content-delta";
        }
    }

    record PageContentCompleted(String id) implements PageRunEvent {
        @Override
        public String type() {
            return "page-content-completed";
        }
    }

    record SectionCreated(String id, String title, int position) implements PageRunEvent {
        @Override
        public String type() {
            return "section-created";
        }
    }

    record SectionContentDelta(String id, String delta) implements PageRunEvent {
        @Override
        public String type() {
            return "section-content-delta";
        }
    }

    record SectionContentCompleted(String id) implements PageRunEvent {
        @Override
        public String type() {
            return "section-content-completed";
        }
    }

    record PageCompleted(String id) implements PageRunEvent {
        @Override
        public String type() {
            return "page-completed";
        }
    }
}

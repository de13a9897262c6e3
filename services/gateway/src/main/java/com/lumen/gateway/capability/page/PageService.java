package com.lumen.gateway.capability.page;

import com.lumen.pagination.FetchWindow;
import com.lumen.security.AuthorizedUser;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.Optional;

/**
 * Generated pages. Creation and generation are split so that the stored page exists before any
 * generated content is streamed.
 */
public interface PageService {

    Optional<Page> get(String id);

    Optional<PageSection> getSection(String id);

    List<Page> list(List<String> ids, FetchWindow window);

    List<PageSection> listSections(String pageId, FetchWindow window);

    void updateTitle(String id, String title);

    void updateContent(String id, String content);

    void updateSectionTitle(String id, String title);

    void updateSectionContent(String id, String content);

    void delete(String id);

    void deleteSection(String id);

    void moveSection(String id, MoveSectionDirection direction);

    /** @return id of the new, empty page */
    String create(String authorId, CreatePageRunInput input);

    /** @return id of the new, empty page seeded from the thread's messages */
    String createFromThread(String authorId, String threadId);

    /** @return id of the new, empty section appended to the page */
    String appendSection(String pageId, String title);

    Flux<PageRunEvent> generatePage(AuthorizedUser user, String pageId, CreatePageRunInput input);

    Flux<PageRunEvent> generatePageFromThread(AuthorizedUser user, String pageId, String threadId);

    Flux<PageRunEvent> generateSection(AuthorizedUser user, String sectionId);
}

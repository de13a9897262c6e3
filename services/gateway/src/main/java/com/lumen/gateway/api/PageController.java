package com.lumen.gateway.api;

import com.lumen.gateway.capability.page.CreatePageRunInput;
import com.lumen.gateway.capability.page.CreatePageSectionRunInput;
import com.lumen.gateway.capability.page.CreateThreadToPageRunInput;
import com.lumen.gateway.capability.page.MoveSectionDirection;
import com.lumen.gateway.capability.page.Page;
import com.lumen.gateway.capability.page.PageRunEvent;
import com.lumen.gateway.capability.page.PageSection;
import com.lumen.gateway.capability.page.TextInput;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.infrastructure.web.RunEventStreams;
import com.lumen.gateway.operation.PageArguments;
import com.lumen.gateway.operation.PageOperations;
import com.lumen.gateway.run.StreamingRunDispatcher;
import com.lumen.pagination.Connection;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.List;

@RestController
@RequestMapping("/api/v1/pages")
public class PageController {

    private final PageOperations operations;
    private final StreamingRunDispatcher dispatcher;
    private final RunEventStreams streams;

    public PageController(PageOperations operations, StreamingRunDispatcher dispatcher, RunEventStreams streams) {
        this.operations = operations;
        this.dispatcher = dispatcher;
        this.streams = streams;
    }

    @GetMapping
    public Connection<Page> pages(RequestContext ctx, @RequestParam(required = false) List<String> ids, PageArguments page) {
        return operations.pages(ctx, ids, page);
    }

    @GetMapping("/{pageId}/sections")
    public Connection<PageSection> pageSections(RequestContext ctx, @PathVariable String pageId, PageArguments page) {
        return operations.pageSections(ctx, pageId, page);
    }

    @PutMapping("/{pageId}/title")
    public boolean updatePageTitle(RequestContext ctx, @PathVariable String pageId, @RequestBody TextInput title) {
        return operations.updatePageTitle(ctx, pageId, title);
    }

    @PutMapping("/{pageId}/content")
    public boolean updatePageContent(RequestContext ctx, @PathVariable String pageId, @RequestBody TextInput content) {
        return operations.updatePageContent(ctx, pageId, content);
    }

    @DeleteMapping("/{pageId}")
    public boolean deletePage(RequestContext ctx, @PathVariable String pageId) {
        return operations.deletePage(ctx, pageId);
    }

    @PutMapping("/sections/{sectionId}/title")
    public boolean updatePageSectionTitle(
            RequestContext ctx, @PathVariable String sectionId, @RequestBody TextInput title) {
        return operations.updatePageSectionTitle(ctx, sectionId, title);
    }

    @PutMapping("/sections/{sectionId}/content")
    public boolean updatePageSectionContent(
            RequestContext ctx, @PathVariable String sectionId, @RequestBody TextInput content) {
        return operations.updatePageSectionContent(ctx, sectionId, content);
    }

    @DeleteMapping("/sections/{sectionId}")
    public boolean deletePageSection(RequestContext ctx, @PathVariable String sectionId) {
        return operations.deletePageSection(ctx, sectionId);
    }

    @PostMapping("/sections/{sectionId}/move")
    public boolean movePageSection(
            RequestContext ctx, @PathVariable String sectionId, @RequestParam MoveSectionDirection direction) {
        return operations.movePageSection(ctx, sectionId, direction);
    }

    @PostMapping("/runs")
    public Flux<ServerSentEvent<Object>> createPageRun(RequestContext ctx, @RequestBody CreatePageRunInput input) {
        return streams.toSse(dispatcher.createPageRun(ctx, input), PageRunEvent::type);
    }

    @PostMapping("/runs/from-thread")
    public Flux<ServerSentEvent<Object>> createThreadToPageRun(
            RequestContext ctx, @RequestBody CreateThreadToPageRunInput input) {
        return streams.toSse(dispatcher.createThreadToPageRun(ctx, input), PageRunEvent::type);
    }

    @PostMapping("/{pageId}/sections/runs")
    public Flux<ServerSentEvent<Object>> createPageSectionRun(
            RequestContext ctx, @PathVariable String pageId, @RequestBody SectionRunRequest request) {
        return streams.toSse(
                dispatcher.createPageSectionRun(ctx, new CreatePageSectionRunInput(pageId, request.titlePrompt())),
                PageRunEvent::type);
    }

    public record SectionRunRequest(String titlePrompt) {
    }
}

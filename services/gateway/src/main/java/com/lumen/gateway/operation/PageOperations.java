package com.lumen.gateway.operation;

import com.lumen.errors.CoreException;
import com.lumen.errors.InputValidator;
import com.lumen.gateway.capability.page.MoveSectionDirection;
import com.lumen.gateway.capability.page.Page;
import com.lumen.gateway.capability.page.PageSection;
import com.lumen.gateway.capability.page.PageService;
import com.lumen.gateway.capability.page.TextInput;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.guard.Guards;
import com.lumen.pagination.Connection;
import com.lumen.pagination.ConnectionBuilder;
import com.lumen.security.AuthorizedUser;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Page queries and edits. Every operation fails with FORBIDDEN when the deployment runs without
 * a page service; edits are limited to the page author.
 */
@Service
public class PageOperations {

    private final InputValidator validator;

    public PageOperations(InputValidator validator) {
        this.validator = validator;
    }

    public Connection<Page> pages(RequestContext ctx, List<String> ids, PageArguments page) {
        Guards.user(ctx);
        PageService pages = Guards.pageService(ctx);
        return ConnectionBuilder.query(page.window(), window -> pages.list(ids, window));
    }

    public Connection<PageSection> pageSections(RequestContext ctx, String pageId, PageArguments page) {
        Guards.user(ctx);
        PageService pages = Guards.pageService(ctx);
        return ConnectionBuilder.query(page.window(), window -> pages.listSections(pageId, window));
    }

    public boolean updatePageTitle(RequestContext ctx, String pageId, TextInput title) {
        AuthorizedUser user = Guards.user(ctx);
        PageService pages = Guards.pageService(ctx);
        validator.validate(title);
        Page page = editablePage(pages, user, pageId);
        pages.updateTitle(page.id(), title.value());
        return true;
    }

    public boolean updatePageContent(RequestContext ctx, String pageId, TextInput content) {
        AuthorizedUser user = Guards.user(ctx);
        PageService pages = Guards.pageService(ctx);
        validator.validate(content);
        Page page = editablePage(pages, user, pageId);
        pages.updateContent(page.id(), content.value());
        return true;
    }

    public boolean updatePageSectionTitle(RequestContext ctx, String sectionId, TextInput title) {
        AuthorizedUser user = Guards.user(ctx);
        PageService pages = Guards.pageService(ctx);
        validator.validate(title);
        PageSection section = editableSection(pages, user, sectionId);
        pages.updateSectionTitle(section.id(), title.value());
        return true;
    }

    public boolean updatePageSectionContent(RequestContext ctx, String sectionId, TextInput content) {
        AuthorizedUser user = Guards.user(ctx);
        PageService pages = Guards.pageService(ctx);
        validator.validate(content);
        PageSection section = editableSection(pages, user, sectionId);
        pages.updateSectionContent(section.id(), content.value());
        return true;
    }

    public boolean deletePage(RequestContext ctx, String pageId) {
        AuthorizedUser user = Guards.user(ctx);
        PageService pages = Guards.pageService(ctx);
        Page page = editablePage(pages, user, pageId);
        pages.delete(page.id());
        return true;
    }

    public boolean deletePageSection(RequestContext ctx, String sectionId) {
        AuthorizedUser user = Guards.user(ctx);
        PageService pages = Guards.pageService(ctx);
        PageSection section = editableSection(pages, user, sectionId);
        pages.deleteSection(section.id());
        return true;
    }

    public boolean movePageSection(RequestContext ctx, String sectionId, MoveSectionDirection direction) {
        AuthorizedUser user = Guards.user(ctx);
        PageService pages = Guards.pageService(ctx);
        if (direction == null) {
            throw CoreException.invalidInput("direction", "must not be null");
        }
        PageSection section = editableSection(pages, user, sectionId);
        pages.moveSection(section.id(), direction);
        return true;
    }

    static Page editablePage(PageService pages, AuthorizedUser user, String pageId) {
        Page page = pages.get(pageId).orElseThrow(() -> CoreException.notFound("Page not found"));
        user.policy().checkUpdatePage(page.authorId());
        return page;
    }

    private static PageSection editableSection(PageService pages, AuthorizedUser user, String sectionId) {
        PageSection section = pages.getSection(sectionId)
                .orElseThrow(() -> CoreException.notFound("Page section not found"));
        editablePage(pages, user, section.pageId());
        return section;
    }
}

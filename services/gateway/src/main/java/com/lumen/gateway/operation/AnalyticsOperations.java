package com.lumen.gateway.operation;

import com.lumen.errors.CoreException;
import com.lumen.gateway.capability.analytic.ChatCompletionStats;
import com.lumen.gateway.capability.analytic.CompletionStats;
import com.lumen.gateway.capability.analytic.UserEvent;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.guard.Guards;
import com.lumen.pagination.Connection;
import com.lumen.pagination.ConnectionBuilder;
import com.lumen.security.AuthorizedUser;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Usage statistics. Non-admins may only query their own numbers.
 */
@Service
public class AnalyticsOperations {

    public List<CompletionStats> dailyStatsInPastYear(RequestContext ctx, List<String> users) {
        List<String> scope = readableUsers(ctx, users);
        return ctx.services().analytic().dailyStatsInPastYear(scope);
    }

    public List<CompletionStats> dailyStats(
            RequestContext ctx, Instant start, Instant end, List<String> users, List<String> languages) {
        List<String> scope = readableUsers(ctx, users);
        requireRange(start, end);
        return ctx.services().analytic().dailyStats(start, end, scope, languages == null ? List.of() : languages);
    }

    public List<ChatCompletionStats> chatDailyStatsInPastYear(RequestContext ctx, List<String> users) {
        List<String> scope = readableUsers(ctx, users);
        return ctx.services().analytic().chatDailyStatsInPastYear(scope);
    }

    public List<ChatCompletionStats> chatDailyStats(RequestContext ctx, Instant start, Instant end, List<String> users) {
        List<String> scope = readableUsers(ctx, users);
        requireRange(start, end);
        return ctx.services().analytic().chatDailyStats(start, end, scope);
    }

    public Connection<UserEvent> userEvents(
            RequestContext ctx, List<String> users, Instant start, Instant end, PageArguments page) {
        Guards.admin(ctx);
        return ConnectionBuilder.query(page.window(), window -> ctx.services().userEvent()
                .list(users == null ? List.of() : users, start, end, window));
    }

    private static List<String> readableUsers(RequestContext ctx, List<String> users) {
        AuthorizedUser user = Guards.user(ctx);
        List<String> scope = users == null ? List.of() : users;
        user.policy().checkReadAnalytic(scope);
        return scope;
    }

    private static void requireRange(Instant start, Instant end) {
        if (start == null || end == null) {
            throw CoreException.invalidInput(start == null ? "start" : "end", "must not be null");
        }
        if (!end.isAfter(start)) {
            throw CoreException.invalidInput("end", "must be after start");
        }
    }
}

package com.lumen.gateway.api;

import com.lumen.gateway.capability.analytic.ChatCompletionStats;
import com.lumen.gateway.capability.analytic.CompletionStats;
import com.lumen.gateway.capability.analytic.UserEvent;
import com.lumen.gateway.context.RequestContext;
import com.lumen.gateway.operation.AnalyticsOperations;
import com.lumen.gateway.operation.PageArguments;
import com.lumen.pagination.Connection;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/v1/analytics")
public class AnalyticsController {

    private final AnalyticsOperations operations;

    public AnalyticsController(AnalyticsOperations operations) {
        this.operations = operations;
    }

    @GetMapping("/completions/past-year")
    public List<CompletionStats> dailyStatsInPastYear(
            RequestContext ctx, @RequestParam(required = false) List<String> users) {
        return operations.dailyStatsInPastYear(ctx, users);
    }

    @GetMapping("/completions")
    public List<CompletionStats> dailyStats(
            RequestContext ctx,
            @RequestParam Instant start,
            @RequestParam Instant end,
            @RequestParam(required = false) List<String> users,
            @RequestParam(required = false) List<String> languages) {
        return operations.dailyStats(ctx, start, end, users, languages);
    }

    @GetMapping("/chats/past-year")
    public List<ChatCompletionStats> chatDailyStatsInPastYear(
            RequestContext ctx, @RequestParam(required = false) List<String> users) {
        return operations.chatDailyStatsInPastYear(ctx, users);
    }

    @GetMapping("/chats")
    public List<ChatCompletionStats> chatDailyStats(
            RequestContext ctx,
            @RequestParam Instant start,
            @RequestParam Instant end,
            @RequestParam(required = false) List<String> users) {
        return operations.chatDailyStats(ctx, start, end, users);
    }

    @GetMapping("/user-events")
    public Connection<UserEvent> userEvents(
            RequestContext ctx,
            @RequestParam(required = false) List<String> users,
            @RequestParam(required = false) Instant start,
            @RequestParam(required = false) Instant end,
            PageArguments page) {
        return operations.userEvents(ctx, users, start, end, page);
    }
}

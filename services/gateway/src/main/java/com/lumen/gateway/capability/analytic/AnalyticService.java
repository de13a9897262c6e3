package com.lumen.gateway.capability.analytic;

import java.time.Instant;
import java.util.List;

/**
 * Usage statistics. An empty user list aggregates over every user.
 */
public interface AnalyticService {

    List<CompletionStats> dailyStatsInPastYear(List<String> users);

    List<CompletionStats> dailyStats(Instant start, Instant end, List<String> users, List<String> languages);

    List<ChatCompletionStats> chatDailyStatsInPastYear(List<String> users);

    List<ChatCompletionStats> chatDailyStats(Instant start, Instant end, List<String> users);
}

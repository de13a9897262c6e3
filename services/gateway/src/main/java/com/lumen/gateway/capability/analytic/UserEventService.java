package com.lumen.gateway.capability.analytic;

import com.lumen.pagination.FetchWindow;

import java.time.Instant;
import java.util.List;

public interface UserEventService {

    List<UserEvent> list(List<String> users, Instant start, Instant end, FetchWindow window);
}

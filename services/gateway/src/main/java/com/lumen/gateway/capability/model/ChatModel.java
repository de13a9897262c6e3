package com.lumen.gateway.capability.model;

import reactor.core.publisher.Flux;

public interface ChatModel {

    Flux<String> chat(String prompt);
}

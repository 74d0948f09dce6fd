package com.study.webflux.memory.domain.dialogue.port;

import com.study.webflux.memory.domain.dialogue.model.CompletionRequest;

import reactor.core.publisher.Mono;

public interface LlmPort {

	Mono<String> complete(CompletionRequest request);
}

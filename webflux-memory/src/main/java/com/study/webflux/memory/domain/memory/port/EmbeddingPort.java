package com.study.webflux.memory.domain.memory.port;

import java.util.List;

import com.study.webflux.memory.domain.memory.model.MemoryEmbedding;

import reactor.core.publisher.Mono;

public interface EmbeddingPort {

	Mono<MemoryEmbedding> embed(String text);

	/**
	 * 한 번의 호출로 여러 텍스트를 임베딩합니다. 결과 순서는 입력 순서와 같습니다.
	 */
	Mono<List<MemoryEmbedding>> embedAll(List<String> texts);
}

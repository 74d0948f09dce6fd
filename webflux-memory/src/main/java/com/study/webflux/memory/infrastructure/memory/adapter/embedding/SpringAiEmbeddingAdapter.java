package com.study.webflux.memory.infrastructure.memory.adapter.embedding;

import java.util.ArrayList;
import java.util.List;

import lombok.RequiredArgsConstructor;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Component;

import com.study.webflux.memory.domain.memory.model.MemoryEmbedding;
import com.study.webflux.memory.domain.memory.port.EmbeddingPort;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Spring AI EmbeddingModel 기반 임베딩 어댑터입니다. 여러 텍스트는 한 번의 모델 호출로 처리합니다.
 */
@Component
@RequiredArgsConstructor
public class SpringAiEmbeddingAdapter implements EmbeddingPort {

	private final EmbeddingModel embeddingModel;

	@Override
	public Mono<MemoryEmbedding> embed(String text) {
		if (text == null || text.isBlank()) {
			return Mono.error(new IllegalArgumentException("text cannot be null or blank"));
		}
		return Mono.fromCallable(() -> MemoryEmbedding.of(text, embeddingModel.embed(text)))
			.subscribeOn(Schedulers.boundedElastic());
	}

	@Override
	public Mono<List<MemoryEmbedding>> embedAll(List<String> texts) {
		if (texts == null || texts.isEmpty()) {
			return Mono.just(List.of());
		}
		return Mono.fromCallable(() -> {
			List<float[]> vectors = embeddingModel.embed(texts);
			if (vectors == null || vectors.size() != texts.size()) {
				throw new IllegalStateException("Embedding model returned "
					+ (vectors == null ? 0 : vectors.size()) + " vectors for " + texts.size()
					+ " inputs");
			}
			List<MemoryEmbedding> embeddings = new ArrayList<>(texts.size());
			for (int i = 0; i < texts.size(); i++) {
				embeddings.add(MemoryEmbedding.of(texts.get(i), vectors.get(i)));
			}
			return embeddings;
		}).subscribeOn(Schedulers.boundedElastic());
	}
}

package com.study.webflux.memory.domain.memory.port;

import java.util.List;

import com.study.webflux.memory.domain.memory.model.LongTermMemoryRecord;
import com.study.webflux.memory.domain.memory.model.MemoryMatch;
import com.study.webflux.memory.domain.memory.model.MemorySearchFilter;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 장기 기억 벡터 저장소 포트입니다. 같은 id로 upsert하면 기존 레코드를 덮어씁니다.
 */
public interface VectorMemoryPort {

	/**
	 * 임베딩이 채워진 레코드를 저장하고 저장된 개수를 반환합니다.
	 */
	Mono<Integer> upsertAll(List<LongTermMemoryRecord> records);

	Flux<MemoryMatch> search(List<Float> queryEmbedding,
		MemorySearchFilter filter,
		int topK,
		float scoreThreshold);

	Mono<Void> delete(MemorySearchFilter filter);
}

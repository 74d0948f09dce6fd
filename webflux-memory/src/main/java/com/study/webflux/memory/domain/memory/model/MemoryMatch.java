package com.study.webflux.memory.domain.memory.model;

/** 벡터 검색으로 찾은 장기 기억과 유사도 점수입니다. */
public record MemoryMatch(
	LongTermMemoryRecord record,
	float score
) {
	public MemoryMatch {
		if (record == null) {
			throw new IllegalArgumentException("record cannot be null");
		}
	}

	public MemoryRecordMetadata metadata() {
		return record.metadata();
	}

	public int scorePercent() {
		return Math.round(score * 100);
	}
}

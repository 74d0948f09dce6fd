package com.study.webflux.memory.infrastructure.memory.adapter.vectordb.dto;

import java.util.List;

/**
 * Qdrant 필터의 must 조건 목록입니다. 모든 조건이 keyword 일치 비교입니다.
 */
public record QdrantFilter(
	List<FilterCondition> must
) {
	public record FilterCondition(
		String key,
		Match match
	) {
		public static FilterCondition matchValue(String key, String value) {
			return new FilterCondition(key, new Match(value));
		}
	}

	public record Match(
		Object value
	) {
	}
}

package com.study.webflux.memory.domain.memory.model;

/**
 * 질의별 조회 깊이입니다.
 */
public enum RetrievalStrategy {
	/** 어떤 저장소도 조회하지 않습니다. */
	SKIP("skip"),
	/** 사용자 프로필만 사용합니다. */
	PROFILE_ONLY("profile-only"),
	/** 최근 대화 캐시를 사용합니다. */
	CACHED("cached"),
	/** 세션, 요약, 장기 기억을 모두 조회합니다. */
	FULL("full");

	private final String value;

	RetrievalStrategy(String value) {
		this.value = value;
	}

	public String value() {
		return value;
	}
}

package com.study.webflux.memory.domain.memory.model;

/**
 * 프롬프트에 붙일 기억 문맥과 조회 경로 정보입니다. contextText가 비어 있으면 추가할 문맥이 없다는 뜻입니다.
 */
public record MemorySearchResult(
	String contextText,
	ResultCounts counts,
	boolean usedProfile,
	boolean skippedDurableSearch,
	RetrievalStrategy strategy,
	String reason
) {
	public MemorySearchResult {
		if (strategy == null) {
			throw new IllegalArgumentException("strategy cannot be null");
		}
		contextText = contextText == null ? "" : contextText;
		counts = counts == null ? ResultCounts.none() : counts;
	}

	public static MemorySearchResult skipped(StrategyDecision decision) {
		return new MemorySearchResult("", ResultCounts.none(), false, false, decision.strategy(),
			decision.reason());
	}

	public static MemorySearchResult profileOnly(String profileContext, StrategyDecision decision) {
		return new MemorySearchResult(profileContext, ResultCounts.none(),
			!profileContext.isBlank(), false, decision.strategy(), decision.reason());
	}

	public boolean isEmpty() {
		return contextText.isBlank();
	}

	public record ResultCounts(
		int local,
		int longTerm,
		int summaries
	) {
		public static ResultCounts none() {
			return new ResultCounts(0, 0, 0);
		}

		public int total() {
			return local + longTerm + summaries;
		}
	}
}

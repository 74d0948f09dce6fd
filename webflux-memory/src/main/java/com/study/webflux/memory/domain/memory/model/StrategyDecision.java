package com.study.webflux.memory.domain.memory.model;

public record StrategyDecision(
	RetrievalStrategy strategy,
	String reason
) {
	public StrategyDecision {
		if (strategy == null) {
			throw new IllegalArgumentException("strategy cannot be null");
		}
		if (reason == null || reason.isBlank()) {
			throw new IllegalArgumentException("reason cannot be null or blank");
		}
	}

	public static StrategyDecision of(RetrievalStrategy strategy, String reason) {
		return new StrategyDecision(strategy, reason);
	}

	public static StrategyDecision forced(RetrievalStrategy strategy) {
		return new StrategyDecision(strategy, "override");
	}
}

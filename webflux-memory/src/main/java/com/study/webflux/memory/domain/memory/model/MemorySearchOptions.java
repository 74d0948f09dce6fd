package com.study.webflux.memory.domain.memory.model;

import java.util.Locale;

/**
 * 검색 깊이와 비용 최적화 설정입니다. strategyOverride가 있으면 자동 판별을 건너뜁니다.
 */
public record MemorySearchOptions(
	int maxLocalResults,
	int maxLongTermResults,
	float threshold,
	boolean skipDurableIfLocalFound,
	int minLocalResultsForSkip,
	boolean includeLocalSummaries,
	int localScanLimit,
	RetrievalStrategy strategyOverride
) {
	public static final int DEFAULT_LOCAL_SCAN_LIMIT = 50;

	public MemorySearchOptions {
		if (maxLocalResults < 0) {
			throw new IllegalArgumentException("maxLocalResults cannot be negative");
		}
		if (maxLongTermResults < 0) {
			throw new IllegalArgumentException("maxLongTermResults cannot be negative");
		}
		if (threshold < 0.0f || threshold > 1.0f) {
			throw new IllegalArgumentException("threshold must be between 0 and 1");
		}
		if (minLocalResultsForSkip < 0) {
			throw new IllegalArgumentException("minLocalResultsForSkip cannot be negative");
		}
		if (localScanLimit <= 0) {
			throw new IllegalArgumentException("localScanLimit must be positive");
		}
	}

	public static MemorySearchOptions balanced() {
		return new MemorySearchOptions(3, 2, 0.3f, true, 2, true, DEFAULT_LOCAL_SCAN_LIMIT, null);
	}

	public static MemorySearchOptions costOptimized() {
		return new MemorySearchOptions(3, 1, 0.4f, true, 1, true, DEFAULT_LOCAL_SCAN_LIMIT, null);
	}

	public static MemorySearchOptions comprehensive() {
		return new MemorySearchOptions(5, 5, 0.2f, false, 0, true, DEFAULT_LOCAL_SCAN_LIMIT, null);
	}

	public static MemorySearchOptions preset(String name) {
		if (name == null || name.isBlank()) {
			return balanced();
		}
		return switch (name.trim().toLowerCase(Locale.ROOT)) {
			case "balanced" -> balanced();
			case "cost-optimized", "costoptimized", "cost_optimized" -> costOptimized();
			case "comprehensive" -> comprehensive();
			default -> throw new IllegalArgumentException("Unknown search preset: " + name);
		};
	}

	public MemorySearchOptions withStrategyOverride(RetrievalStrategy strategy) {
		return new MemorySearchOptions(maxLocalResults, maxLongTermResults, threshold,
			skipDurableIfLocalFound, minLocalResultsForSkip, includeLocalSummaries, localScanLimit,
			strategy);
	}

	public MemorySearchOptions withLimits(int maxLocalResults, int maxLongTermResults) {
		return new MemorySearchOptions(maxLocalResults, maxLongTermResults, threshold,
			skipDurableIfLocalFound, minLocalResultsForSkip, includeLocalSummaries, localScanLimit,
			strategyOverride);
	}

	public MemorySearchOptions withThreshold(float threshold) {
		return new MemorySearchOptions(maxLocalResults, maxLongTermResults, threshold,
			skipDurableIfLocalFound, minLocalResultsForSkip, includeLocalSummaries, localScanLimit,
			strategyOverride);
	}

	public MemorySearchOptions withDurableSkip(boolean enabled, int minLocalResults) {
		return new MemorySearchOptions(maxLocalResults, maxLongTermResults, threshold, enabled,
			minLocalResults, includeLocalSummaries, localScanLimit, strategyOverride);
	}

	public MemorySearchOptions withLocalScanLimit(int localScanLimit) {
		return new MemorySearchOptions(maxLocalResults, maxLongTermResults, threshold,
			skipDurableIfLocalFound, minLocalResultsForSkip, includeLocalSummaries, localScanLimit,
			strategyOverride);
	}

	public MemorySearchOptions withLocalSummaries(boolean include) {
		return new MemorySearchOptions(maxLocalResults, maxLongTermResults, threshold,
			skipDurableIfLocalFound, minLocalResultsForSkip, include, localScanLimit,
			strategyOverride);
	}

	public boolean hasStrategyOverride() {
		return strategyOverride != null;
	}
}

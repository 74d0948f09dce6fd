package com.study.webflux.memory.domain.memory.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemorySearchOptionsTest {

	@Test
	@DisplayName("balanced 프리셋 값")
	void balanced_values() {
		MemorySearchOptions options = MemorySearchOptions.balanced();

		assertThat(options.maxLocalResults()).isEqualTo(3);
		assertThat(options.maxLongTermResults()).isEqualTo(2);
		assertThat(options.threshold()).isEqualTo(0.3f);
		assertThat(options.skipDurableIfLocalFound()).isTrue();
		assertThat(options.minLocalResultsForSkip()).isEqualTo(2);
		assertThat(options.hasStrategyOverride()).isFalse();
	}

	@Test
	@DisplayName("comprehensive 프리셋은 장기 기억 검색을 생략하지 않음")
	void comprehensive_neverSkipsDurable() {
		MemorySearchOptions options = MemorySearchOptions.comprehensive();

		assertThat(options.skipDurableIfLocalFound()).isFalse();
		assertThat(options.maxLongTermResults()).isEqualTo(5);
		assertThat(options.threshold()).isEqualTo(0.2f);
	}

	@Test
	@DisplayName("프리셋 이름으로 조회")
	void preset_byName() {
		assertThat(MemorySearchOptions.preset("cost-optimized"))
			.isEqualTo(MemorySearchOptions.costOptimized());
		assertThat(MemorySearchOptions.preset(null)).isEqualTo(MemorySearchOptions.balanced());
		assertThatThrownBy(() -> MemorySearchOptions.preset("turbo"))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("Unknown search preset");
	}

	@Test
	@DisplayName("임계값은 0과 1 사이")
	void threshold_outOfRange_throwsException() {
		assertThatThrownBy(() -> MemorySearchOptions.balanced().withThreshold(1.5f))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("threshold must be between 0 and 1");
	}

	@Test
	@DisplayName("전략 강제 지정")
	void withStrategyOverride_setsOverride() {
		MemorySearchOptions options = MemorySearchOptions.balanced()
			.withStrategyOverride(RetrievalStrategy.CACHED);

		assertThat(options.hasStrategyOverride()).isTrue();
		assertThat(options.strategyOverride()).isEqualTo(RetrievalStrategy.CACHED);
		assertThat(options.maxLocalResults()).isEqualTo(3);
	}
}

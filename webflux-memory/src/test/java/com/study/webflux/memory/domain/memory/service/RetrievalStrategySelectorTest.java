package com.study.webflux.memory.domain.memory.service;

import java.util.List;

import com.study.webflux.memory.domain.memory.model.RetrievalStrategy;
import com.study.webflux.memory.domain.memory.model.StrategyDecision;
import com.study.webflux.memory.domain.memory.model.StrategyPatterns;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class RetrievalStrategySelectorTest {

	private final RetrievalStrategySelector selector = new RetrievalStrategySelector(
		StrategyPatterns.defaults());

	@Test
	@DisplayName("채팅 초반 인사말은 프로필만 조회")
	void earlyGreeting_returnsProfileOnly() {
		StrategyDecision decision = selector.decide("hi", 0);

		assertThat(decision.strategy()).isEqualTo(RetrievalStrategy.PROFILE_ONLY);
		assertThat(decision.reason()).isEqualTo("early greeting");
	}

	@Test
	@DisplayName("대화 중반 인사말은 조회 생략")
	void lateGreeting_returnsSkip() {
		assertThat(selector.select("Hello there!", 5)).isEqualTo(RetrievalStrategy.SKIP);
	}

	@ParameterizedTest
	@ValueSource(strings = {"thanks", "Thank you!", "ok", "got it.", "  cool  "})
	@DisplayName("단독 맞장구는 조회 생략")
	void acknowledgment_returnsSkip(String query) {
		StrategyDecision decision = selector.decide(query, 5);

		assertThat(decision.strategy()).isEqualTo(RetrievalStrategy.SKIP);
		assertThat(decision.reason()).isEqualTo("acknowledgment");
	}

	@Test
	@DisplayName("맞장구 뒤에 다른 내용이 이어지면 맞장구로 보지 않음")
	void acknowledgmentWithFollowUp_isNotSkipped() {
		assertThat(selector.select("thanks, now tell me about the enterprise tier", 5))
			.isEqualTo(RetrievalStrategy.FULL);
	}

	@Test
	@DisplayName("과거 대화를 가리키면 전체 조회")
	void memoryReference_returnsFull() {
		StrategyDecision decision = selector.decide("remember what we discussed about pricing?", 5);

		assertThat(decision.strategy()).isEqualTo(RetrievalStrategy.FULL);
		assertThat(decision.reason()).isEqualTo("explicit memory reference");
		assertThat(selector.select("recall that?", 5)).isEqualTo(RetrievalStrategy.FULL);
	}

	@Test
	@DisplayName("짧은 개인 정보 질의는 프로필만 조회")
	void personalInfo_returnsProfileOnly() {
		StrategyDecision decision = selector.decide("what is my name?", 4);

		assertThat(decision.strategy()).isEqualTo(RetrievalStrategy.PROFILE_ONLY);
		assertThat(decision.reason()).isEqualTo("personal info query");
	}

	@Test
	@DisplayName("긴 질의는 전체 조회")
	void longQuery_returnsFull() {
		StrategyDecision decision = selector
			.decide("Can you draft an onboarding email for new enterprise customers", 3);

		assertThat(decision.strategy()).isEqualTo(RetrievalStrategy.FULL);
		assertThat(decision.reason()).isEqualTo("complex query");
	}

	@Test
	@DisplayName("그 외 짧은 질의는 프로필만 조회")
	void shortQuery_returnsProfileOnly() {
		StrategyDecision decision = selector.decide("draft an email", 3);

		assertThat(decision.strategy()).isEqualTo(RetrievalStrategy.PROFILE_ONLY);
		assertThat(decision.reason()).isEqualTo("short query");
	}

	@Test
	@DisplayName("인사말로 시작하는 단어는 인사말로 보지 않음")
	void wordStartingWithGreeting_isNotGreeting() {
		assertThat(selector.decide("history", 5).reason()).isEqualTo("short query");
	}

	@Test
	@DisplayName("턴 순번이 없으면 0으로 간주하고 빈 질의도 처리")
	void nullInputs_areHandled() {
		assertThat(selector.select("hey", null)).isEqualTo(RetrievalStrategy.PROFILE_ONLY);
		assertThat(selector.select(null, null)).isEqualTo(RetrievalStrategy.PROFILE_ONLY);
	}

	@Test
	@DisplayName("같은 입력은 항상 같은 결정")
	void decide_isDeterministic() {
		String query = "What did you say before about the launch plan?";

		assertThat(selector.decide(query, 7)).isEqualTo(selector.decide(query, 7));
	}

	@Test
	@DisplayName("사용자 지정 어휘와 길이 기준 반영")
	void customPatterns_areApplied() {
		RetrievalStrategySelector custom = new RetrievalStrategySelector(new StrategyPatterns(
			List.of("ahoy"), List.of("roger"), List.of("flashback"), List.of(), 10, 0));

		assertThat(custom.select("ahoy", 1)).isEqualTo(RetrievalStrategy.SKIP);
		assertThat(custom.select("roger", 1)).isEqualTo(RetrievalStrategy.SKIP);
		assertThat(custom.select("flashback", 1)).isEqualTo(RetrievalStrategy.FULL);
		assertThat(custom.select("hello world!", 1)).isEqualTo(RetrievalStrategy.FULL);
	}
}

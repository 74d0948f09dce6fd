package com.study.webflux.memory.domain.memory.service;

import java.time.Instant;
import java.util.List;

import com.study.webflux.memory.domain.dialogue.model.ConversationTurn;
import com.study.webflux.memory.fixture.ConversationTurnFixture;
import com.study.webflux.memory.fixture.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LocalRelevanceRankerTest {

	private static final Instant START = MutableClock.DEFAULT_START;

	private final ConversationTurn pricing = ConversationTurnFixture.create("t-1",
		"Let's talk pricing for the starter plan", "Starter plan pricing could be 19 dollars",
		START);
	private final ConversationTurn hiring = ConversationTurnFixture.create("t-2",
		"We need to hire two engineers", "Post the roles on job boards", START.plusSeconds(60));
	private final ConversationTurn pricingLater = ConversationTurnFixture.create("t-3",
		"Enterprise pricing too?", "Enterprise deals are negotiated", START.plusSeconds(120));

	@Test
	@DisplayName("겹치는 키워드가 많은 턴이 먼저 옴")
	void rank_ordersByOverlap() {
		List<ConversationTurn> ranked = LocalRelevanceRanker.rank("starter plan pricing",
			List.of(hiring, pricingLater, pricing), 3);

		assertThat(ranked).containsExactly(pricing, pricingLater);
	}

	@Test
	@DisplayName("점수가 같으면 최신 턴이 먼저 옴")
	void rank_tieBreaksByRecency() {
		List<ConversationTurn> ranked = LocalRelevanceRanker.rank("pricing",
			List.of(pricing, pricingLater), 2);

		assertThat(ranked).containsExactly(pricingLater, pricing);
	}

	@Test
	@DisplayName("topK 개수만큼만 반환")
	void rank_respectsTopK() {
		assertThat(LocalRelevanceRanker.rank("pricing", List.of(pricing, pricingLater), 1))
			.containsExactly(pricingLater);
		assertThat(LocalRelevanceRanker.rank("pricing", List.of(pricing), 0)).isEmpty();
	}

	@Test
	@DisplayName("불용어만 있는 질의는 결과 없음")
	void rank_stopWordsOnly_returnsEmpty() {
		assertThat(LocalRelevanceRanker.rank("what is the", List.of(pricing, hiring), 3)).isEmpty();
		assertThat(LocalRelevanceRanker.rank(null, List.of(pricing), 3)).isEmpty();
	}

	@Test
	@DisplayName("대소문자와 구두점을 무시하고 교집합 계산")
	void scoreByTokenIntersection_ignoresCaseAndPunctuation() {
		assertThat(LocalRelevanceRanker.scoreByTokenIntersection("PRICING, plan!",
			"the plan's pricing")).isEqualTo(2);
	}
}

package com.study.webflux.memory.domain.memory.service;

import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import com.study.webflux.memory.domain.dialogue.model.ConversationTurn;

/**
 * 키워드 교집합 기반으로 세션 턴의 관련도를 계산합니다.
 */
public final class LocalRelevanceRanker {

	private static final Set<String> STOP_WORDS = Set.of("a", "an", "the", "and", "or", "but",
		"is", "are", "was", "were", "be", "to", "of", "in", "on", "at", "for", "with", "it",
		"this", "that", "do", "does", "did", "i", "you", "we", "me", "my", "your", "what", "how",
		"can", "about");

	private static final Comparator<ScoredTurn> BY_RELEVANCE = Comparator
		.comparingInt(ScoredTurn::score)
		.reversed()
		.thenComparing(scored -> scored.turn().timestamp(), Comparator.reverseOrder());

	private LocalRelevanceRanker() {
	}

	/**
	 * 질의와 겹치는 토큰이 하나 이상인 턴만 점수 내림차순으로 반환합니다. 점수가 같으면 최신 턴이 앞에 옵니다.
	 */
	public static List<ConversationTurn> rank(String query, List<ConversationTurn> turns, int topK) {
		if (topK <= 0 || turns == null || turns.isEmpty()) {
			return List.of();
		}
		Set<String> queryTokens = tokenize(query);
		if (queryTokens.isEmpty()) {
			return List.of();
		}
		return turns.stream()
			.map(turn -> new ScoredTurn(turn,
				intersectionSize(queryTokens, tokenize(turn.userPrompt() + " " + turn.aiResponse()))))
			.filter(scored -> scored.score() > 0)
			.sorted(BY_RELEVANCE)
			.limit(topK)
			.map(ScoredTurn::turn)
			.toList();
	}

	public static int scoreByTokenIntersection(String query, String candidate) {
		return intersectionSize(tokenize(query), tokenize(candidate));
	}

	private static int intersectionSize(Set<String> queryTokens, Set<String> candidateTokens) {
		Set<String> intersection = new HashSet<>(queryTokens);
		intersection.retainAll(candidateTokens);
		return intersection.size();
	}

	private static Set<String> tokenize(String text) {
		if (text == null || text.isBlank()) {
			return Set.of();
		}
		return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
			.filter(word -> !word.isEmpty())
			.filter(word -> !STOP_WORDS.contains(word))
			.collect(Collectors.toSet());
	}

	private record ScoredTurn(ConversationTurn turn, int score) {
	}
}

package com.study.webflux.memory.domain.memory.model;

import java.util.List;

/**
 * 조회 전략 판별에 쓰는 어휘 목록과 길이 기준입니다. 모든 항목은 소문자로 비교됩니다.
 */
public record StrategyPatterns(
	List<String> greetings,
	List<String> acknowledgments,
	List<String> memoryReferences,
	List<String> personalInfo,
	int shortQueryLength,
	int earlyTurnLimit
) {
	public StrategyPatterns {
		greetings = greetings == null ? List.of() : List.copyOf(greetings);
		acknowledgments = acknowledgments == null ? List.of() : List.copyOf(acknowledgments);
		memoryReferences = memoryReferences == null ? List.of() : List.copyOf(memoryReferences);
		personalInfo = personalInfo == null ? List.of() : List.copyOf(personalInfo);
		if (shortQueryLength <= 0) {
			throw new IllegalArgumentException("shortQueryLength must be positive");
		}
		if (earlyTurnLimit < 0) {
			throw new IllegalArgumentException("earlyTurnLimit cannot be negative");
		}
	}

	public static StrategyPatterns defaults() {
		return new StrategyPatterns(
			List.of("hi", "hello", "hey", "yo", "sup", "greetings", "good morning",
				"good afternoon", "good evening", "howdy"),
			List.of("thanks", "thank you", "thx", "ty", "ok", "okay", "k", "cool", "nice", "great",
				"got it", "sure", "yes", "no", "yep", "nope", "alright", "awesome", "perfect",
				"sounds good"),
			List.of("remember", "recall", "earlier", "we discussed", "ago", "last time", "you said",
				"you told", "previous", "before", "mentioned"),
			List.of("my name", "who am i", "about me", "my job", "my work", "i work", "my role",
				"my interests", "my preferences", "what do i like"),
			30,
			2);
	}
}

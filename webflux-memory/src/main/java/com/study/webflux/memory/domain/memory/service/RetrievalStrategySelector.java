package com.study.webflux.memory.domain.memory.service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.study.webflux.memory.domain.memory.model.RetrievalStrategy;
import com.study.webflux.memory.domain.memory.model.StrategyDecision;
import com.study.webflux.memory.domain.memory.model.StrategyPatterns;

/**
 * 질의 문자열과 채팅 내 턴 순번만으로 조회 전략을 고르는 순수 판별기입니다.
 *
 * <p>
 * 규칙은 위에서부터 처음 일치하는 것을 사용합니다.
 * <ol>
 * <li>인사말(단독 또는 인사말로 시작): 초반 턴이면 profile-only, 이후에는 skip</li>
 * <li>단독 맞장구: skip</li>
 * <li>과거 대화를 가리키는 표현: full</li>
 * <li>짧은 개인 정보 질의: profile-only</li>
 * <li>기준 길이 이상의 질의: full</li>
 * <li>그 외: profile-only</li>
 * </ol>
 */
public class RetrievalStrategySelector {

	private static final Pattern NEVER_MATCHES = Pattern.compile("(?!)");

	private final StrategyPatterns patterns;
	private final Pattern greetingPattern;
	private final Pattern acknowledgmentPattern;
	private final Pattern memoryReferencePattern;
	private final Pattern personalInfoPattern;

	public RetrievalStrategySelector(StrategyPatterns patterns) {
		if (patterns == null) {
			throw new IllegalArgumentException("patterns cannot be null");
		}
		this.patterns = patterns;
		this.greetingPattern = compile(patterns.greetings(), "^(?:", ")(?:\\b.*)?$");
		this.acknowledgmentPattern = compile(patterns.acknowledgments(), "^(?:", ")[\\s.!?,]*$");
		this.memoryReferencePattern = compile(patterns.memoryReferences(), "\\b(?:", ")\\b");
		this.personalInfoPattern = compile(patterns.personalInfo(), "\\b(?:", ")\\b");
	}

	public RetrievalStrategy select(String query, Integer turnIndex) {
		return decide(query, turnIndex).strategy();
	}

	public StrategyDecision decide(String query, Integer turnIndex) {
		String normalized = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
		int index = turnIndex == null ? 0 : turnIndex;

		if (greetingPattern.matcher(normalized).matches()) {
			return index <= patterns.earlyTurnLimit()
				? StrategyDecision.of(RetrievalStrategy.PROFILE_ONLY, "early greeting")
				: StrategyDecision.of(RetrievalStrategy.SKIP, "greeting");
		}
		if (acknowledgmentPattern.matcher(normalized).matches()) {
			return StrategyDecision.of(RetrievalStrategy.SKIP, "acknowledgment");
		}
		if (memoryReferencePattern.matcher(normalized).find()) {
			return StrategyDecision.of(RetrievalStrategy.FULL, "explicit memory reference");
		}

		boolean shortQuery = normalized.length() < patterns.shortQueryLength();
		if (shortQuery && personalInfoPattern.matcher(normalized).find()) {
			return StrategyDecision.of(RetrievalStrategy.PROFILE_ONLY, "personal info query");
		}
		if (!shortQuery) {
			return StrategyDecision.of(RetrievalStrategy.FULL, "complex query");
		}
		return StrategyDecision.of(RetrievalStrategy.PROFILE_ONLY, "short query");
	}

	private static Pattern compile(List<String> words, String prefix, String suffix) {
		List<String> alternatives = words.stream()
			.filter(word -> word != null && !word.isBlank())
			.map(word -> Pattern.quote(word.trim().toLowerCase(Locale.ROOT)))
			.toList();
		if (alternatives.isEmpty()) {
			return NEVER_MATCHES;
		}
		return Pattern.compile(prefix + alternatives.stream().collect(Collectors.joining("|"))
			+ suffix, Pattern.DOTALL);
	}
}

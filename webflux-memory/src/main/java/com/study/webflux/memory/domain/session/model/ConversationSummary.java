package com.study.webflux.memory.domain.session.model;

import java.time.Instant;

/**
 * 채팅 하나를 압축한 요약문입니다. turnCount는 요약 시점까지 포함된 턴 수입니다.
 */
public record ConversationSummary(
	ChatSessionKey key,
	String summary,
	int turnCount,
	Instant createdAt
) {
	public ConversationSummary {
		if (key == null) {
			throw new IllegalArgumentException("key cannot be null");
		}
		if (summary == null || summary.isBlank()) {
			throw new IllegalArgumentException("summary cannot be null or blank");
		}
		if (turnCount < 0) {
			throw new IllegalArgumentException("turnCount cannot be negative");
		}
		if (createdAt == null) {
			throw new IllegalArgumentException("createdAt cannot be null");
		}
	}

	public static ConversationSummary of(ChatSessionKey key,
		String summary,
		int turnCount,
		Instant createdAt) {
		return new ConversationSummary(key, summary.trim(), turnCount, createdAt);
	}
}

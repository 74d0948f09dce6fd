package com.study.webflux.memory.domain.dialogue.model;

import java.time.Instant;
import java.util.UUID;

/**
 * 사용자 메시지와 어시스턴트 응답으로 이루어진 하나의 대화 교환입니다. 생성 후에는 변경되지 않습니다.
 */
public record ConversationTurn(
	String turnId,
	UserId userId,
	ChatId chatId,
	String userPrompt,
	String aiResponse,
	Instant timestamp,
	TurnAttachment attachment
) {
	public ConversationTurn {
		if (turnId == null || turnId.isBlank()) {
			throw new IllegalArgumentException("turnId cannot be null or blank");
		}
		if (userId == null) {
			throw new IllegalArgumentException("userId cannot be null");
		}
		if (chatId == null) {
			throw new IllegalArgumentException("chatId cannot be null");
		}
		if (userPrompt == null || userPrompt.isBlank()) {
			throw new IllegalArgumentException("userPrompt cannot be null or blank");
		}
		if (aiResponse == null) {
			throw new IllegalArgumentException("aiResponse cannot be null");
		}
		if (timestamp == null) {
			throw new IllegalArgumentException("timestamp cannot be null");
		}
	}

	public static ConversationTurn create(UserId userId,
		ChatId chatId,
		String userPrompt,
		String aiResponse,
		Instant timestamp) {
		return new ConversationTurn(UUID.randomUUID().toString(), userId, chatId, userPrompt,
			aiResponse, timestamp, null);
	}

	public static ConversationTurn withId(String turnId,
		UserId userId,
		ChatId chatId,
		String userPrompt,
		String aiResponse,
		Instant timestamp) {
		return new ConversationTurn(turnId, userId, chatId, userPrompt, aiResponse, timestamp,
			null);
	}

	public ConversationTurn withAttachment(TurnAttachment attachment) {
		return new ConversationTurn(this.turnId, this.userId, this.chatId, this.userPrompt,
			this.aiResponse, this.timestamp, attachment);
	}

	public boolean hasAttachment() {
		return attachment != null;
	}
}

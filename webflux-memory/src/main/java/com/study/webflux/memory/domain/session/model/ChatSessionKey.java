package com.study.webflux.memory.domain.session.model;

import com.study.webflux.memory.domain.dialogue.model.ChatId;
import com.study.webflux.memory.domain.dialogue.model.UserId;

public record ChatSessionKey(
	UserId userId,
	ChatId chatId
) {
	public ChatSessionKey {
		if (userId == null) {
			throw new IllegalArgumentException("userId cannot be null");
		}
		if (chatId == null) {
			throw new IllegalArgumentException("chatId cannot be null");
		}
	}

	public static ChatSessionKey of(UserId userId, ChatId chatId) {
		return new ChatSessionKey(userId, chatId);
	}

	public String asString() {
		return userId.value() + ":" + chatId.value();
	}
}

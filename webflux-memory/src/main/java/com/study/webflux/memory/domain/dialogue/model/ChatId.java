package com.study.webflux.memory.domain.dialogue.model;

import java.util.UUID;

/** 사용자 하나에 속한 개별 채팅을 식별합니다. */
public record ChatId(
	String value
) {
	public ChatId {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("chatId cannot be null or blank");
		}
		if (value.length() > 128) {
			throw new IllegalArgumentException("chatId too long");
		}
	}

	public static ChatId of(String value) {
		return new ChatId(value);
	}

	public static ChatId generate() {
		return new ChatId(UUID.randomUUID().toString());
	}
}

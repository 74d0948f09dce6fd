package com.study.webflux.memory.fixture;

import com.study.webflux.memory.domain.dialogue.model.ChatId;
import com.study.webflux.memory.domain.dialogue.model.UserId;

public final class UserIdFixture {

	public static final String DEFAULT_USER_ID = "user-1";
	public static final String DEFAULT_CHAT_ID = "chat-1";

	private UserIdFixture() {
	}

	public static UserId create() {
		return UserId.of(DEFAULT_USER_ID);
	}

	public static UserId create(String value) {
		return UserId.of(value);
	}

	public static ChatId chat() {
		return ChatId.of(DEFAULT_CHAT_ID);
	}

	public static ChatId chat(String value) {
		return ChatId.of(value);
	}
}

package com.study.webflux.memory.domain.memory.model;

import com.study.webflux.memory.domain.dialogue.model.ChatId;
import com.study.webflux.memory.domain.dialogue.model.UserId;

/**
 * 벡터 검색과 삭제 범위입니다. chatId가 없으면 사용자의 모든 채팅이 대상입니다.
 */
public record MemorySearchFilter(
	UserId userId,
	ChatId chatId
) {
	public MemorySearchFilter {
		if (userId == null) {
			throw new IllegalArgumentException("userId cannot be null");
		}
	}

	public static MemorySearchFilter forUser(UserId userId) {
		return new MemorySearchFilter(userId, null);
	}

	public static MemorySearchFilter forChat(UserId userId, ChatId chatId) {
		return new MemorySearchFilter(userId, chatId);
	}

	public boolean isChatScoped() {
		return chatId != null;
	}

	public boolean accepts(MemoryMatch match) {
		MemoryRecordMetadata metadata = match.metadata();
		if (!userId.equals(metadata.userId())) {
			return false;
		}
		return chatId == null || chatId.equals(metadata.chatId());
	}
}

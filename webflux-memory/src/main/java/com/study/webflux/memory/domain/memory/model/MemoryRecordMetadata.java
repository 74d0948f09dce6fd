package com.study.webflux.memory.domain.memory.model;

import java.time.Instant;
import java.util.List;

import com.study.webflux.memory.domain.dialogue.model.ChatId;
import com.study.webflux.memory.domain.dialogue.model.TurnAttachment;
import com.study.webflux.memory.domain.dialogue.model.UserId;

/**
 * 장기 기억 레코드의 필터링 및 렌더링용 메타데이터입니다. turnId와 attachment는 요약 레코드에서 비어 있습니다.
 */
public record MemoryRecordMetadata(
	UserId userId,
	ChatId chatId,
	MemoryRecordRole role,
	Instant timestamp,
	String turnId,
	List<String> tags,
	TurnAttachment attachment,
	boolean firstMessage,
	Integer turnCount
) {
	public MemoryRecordMetadata {
		if (userId == null) {
			throw new IllegalArgumentException("userId cannot be null");
		}
		if (chatId == null) {
			throw new IllegalArgumentException("chatId cannot be null");
		}
		if (role == null) {
			throw new IllegalArgumentException("role cannot be null");
		}
		if (timestamp == null) {
			throw new IllegalArgumentException("timestamp cannot be null");
		}
		tags = tags == null ? List.of() : List.copyOf(tags);
	}

	public boolean hasAttachment() {
		return attachment != null;
	}
}

package com.study.webflux.memory.domain.memory.model;

import java.util.List;

import com.study.webflux.memory.domain.dialogue.model.ChatId;
import com.study.webflux.memory.domain.dialogue.model.ConversationTurn;
import com.study.webflux.memory.domain.dialogue.model.UserId;
import com.study.webflux.memory.domain.session.model.ConversationSummary;

/**
 * 벡터 저장소에 보관되는 메시지 단위 기억입니다.
 *
 * <p>
 * id는 {@code userId:chatId:turnId:role} 형식으로 결정적으로 만들어지므로 같은 턴을 다시 업로드해도 중복 레코드가 생기지 않습니다. 채팅 요약은
 * {@code userId:chatId:summary}를 사용합니다.
 */
public record LongTermMemoryRecord(
	String id,
	String content,
	List<Float> embedding,
	MemoryRecordMetadata metadata
) {
	public LongTermMemoryRecord {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("id cannot be null or blank");
		}
		if (content == null) {
			throw new IllegalArgumentException("content cannot be null");
		}
		if (metadata == null) {
			throw new IllegalArgumentException("metadata cannot be null");
		}
		embedding = embedding == null ? null : List.copyOf(embedding);
	}

	public static String recordId(UserId userId, ChatId chatId, String turnId, MemoryRecordRole role) {
		return userId.value() + ":" + chatId.value() + ":" + turnId + ":" + role.value();
	}

	public static String summaryId(UserId userId, ChatId chatId) {
		return userId.value() + ":" + chatId.value() + ":" + MemoryRecordRole.SUMMARY.value();
	}

	public static LongTermMemoryRecord userMessage(ConversationTurn turn, boolean firstMessage) {
		MemoryRecordMetadata metadata = new MemoryRecordMetadata(turn.userId(), turn.chatId(),
			MemoryRecordRole.USER, turn.timestamp(), turn.turnId(),
			List.of("user-message", turn.chatId().value()), turn.attachment(), firstMessage, null);
		return new LongTermMemoryRecord(
			recordId(turn.userId(), turn.chatId(), turn.turnId(), MemoryRecordRole.USER),
			turn.userPrompt(), null, metadata);
	}

	public static LongTermMemoryRecord assistantMessage(ConversationTurn turn) {
		MemoryRecordMetadata metadata = new MemoryRecordMetadata(turn.userId(), turn.chatId(),
			MemoryRecordRole.ASSISTANT, turn.timestamp(), turn.turnId(),
			List.of("assistant-message", turn.chatId().value()), turn.attachment(), false, null);
		return new LongTermMemoryRecord(
			recordId(turn.userId(), turn.chatId(), turn.turnId(), MemoryRecordRole.ASSISTANT),
			turn.aiResponse(), null, metadata);
	}

	public static LongTermMemoryRecord summary(ConversationSummary summary) {
		UserId userId = summary.key().userId();
		ChatId chatId = summary.key().chatId();
		MemoryRecordMetadata metadata = new MemoryRecordMetadata(userId, chatId,
			MemoryRecordRole.SUMMARY, summary.createdAt(), null,
			List.of("conversation-summary", chatId.value()), null, false, summary.turnCount());
		return new LongTermMemoryRecord(summaryId(userId, chatId), summary.summary(), null,
			metadata);
	}

	public LongTermMemoryRecord withEmbedding(List<Float> embedding) {
		return new LongTermMemoryRecord(id, content, embedding, metadata);
	}

	public boolean hasEmbedding() {
		return embedding != null && !embedding.isEmpty();
	}
}

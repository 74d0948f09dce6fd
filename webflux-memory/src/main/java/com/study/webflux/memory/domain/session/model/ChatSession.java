package com.study.webflux.memory.domain.session.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.study.webflux.memory.domain.dialogue.model.ChatId;
import com.study.webflux.memory.domain.dialogue.model.ConversationTurn;
import com.study.webflux.memory.domain.dialogue.model.UserId;

/**
 * (userId, chatId) 단위로 누적되는 대화 세션의 불변 스냅샷입니다.
 *
 * <p>
 * turns는 항상 timestamp 오름차순을 유지하며, 모든 변경 메서드는 새 인스턴스를 반환합니다. 스냅샷들은 추가 전용 턴 기록을 공유하므로
 * 순서대로 도착한 턴의 추가는 기존 턴을 복사하지 않습니다. 영속화 여부는 업로드된 턴 ID 집합으로 판단하므로, 업로드 이후
 * 턴이 추가되면 다시 미영속 상태가 됩니다.
 */
public record ChatSession(
	String sessionId,
	ChatSessionKey key,
	List<ConversationTurn> turns,
	Instant createdAt,
	Instant lastActivity,
	Set<String> persistedTurnIds,
	Instant lastUploadAt,
	ConversationSummary summary
) {
	private static final Comparator<ConversationTurn> CHRONOLOGICAL = Comparator
		.comparing(ConversationTurn::timestamp);

	public ChatSession {
		if (sessionId == null || sessionId.isBlank()) {
			throw new IllegalArgumentException("sessionId cannot be null or blank");
		}
		if (key == null) {
			throw new IllegalArgumentException("key cannot be null");
		}
		if (createdAt == null) {
			throw new IllegalArgumentException("createdAt cannot be null");
		}
		turns = TurnLog.viewOf(turns == null ? List.of() : turns);
		persistedTurnIds = persistedTurnIds == null ? Set.of() : Set.copyOf(persistedTurnIds);
		if (lastActivity == null) {
			lastActivity = createdAt;
		}
	}

	public static ChatSession start(ChatSessionKey key, Instant now) {
		return new ChatSession(UUID.randomUUID().toString(), key, List.of(), now, now, Set.of(),
			null, null);
	}

	public UserId userId() {
		return key.userId();
	}

	public ChatId chatId() {
		return key.chatId();
	}

	public int turnCount() {
		return turns.size();
	}

	/**
	 * timestamp 순서를 유지하며 턴을 삽입합니다. 같은 timestamp라면 기존 턴 뒤에 놓입니다. 마지막 턴보다 늦은 턴은 상수 시간에
	 * 추가됩니다.
	 */
	public ChatSession append(ConversationTurn turn) {
		if (turn == null) {
			throw new IllegalArgumentException("turn cannot be null");
		}
		if (!key.userId().equals(turn.userId()) || !key.chatId().equals(turn.chatId())) {
			throw new IllegalArgumentException("turn does not belong to session " + key.asString());
		}
		List<ConversationTurn> updated = TurnLog.append(turns, turn, CHRONOLOGICAL);

		Instant activity = turn.timestamp().isAfter(lastActivity) ? turn.timestamp() : lastActivity;
		return new ChatSession(sessionId, key, updated, createdAt, activity, persistedTurnIds,
			lastUploadAt, summary);
	}

	public boolean isPersisted() {
		return !turns.isEmpty() && pendingTurns().isEmpty();
	}

	public List<ConversationTurn> pendingTurns() {
		return turns.stream().filter(turn -> !persistedTurnIds.contains(turn.turnId())).toList();
	}

	public boolean isInCooldown(Instant now, Duration cooldown) {
		return lastUploadAt != null && lastUploadAt.plus(cooldown).isAfter(now);
	}

	public boolean isInactiveSince(Instant threshold) {
		return lastActivity.isBefore(threshold);
	}

	public List<ConversationTurn> recentTurns(int limit) {
		if (limit <= 0 || turns.isEmpty()) {
			return List.of();
		}
		int from = Math.max(0, turns.size() - limit);
		return turns.subList(from, turns.size());
	}

	public ChatSession withUploadStartedAt(Instant startedAt) {
		return new ChatSession(sessionId, key, turns, createdAt, lastActivity, persistedTurnIds,
			startedAt, summary);
	}

	public ChatSession withPersistedTurns(Collection<String> turnIds) {
		Set<String> merged = new HashSet<>(persistedTurnIds);
		merged.addAll(turnIds);
		return new ChatSession(sessionId, key, turns, createdAt, lastActivity, merged,
			lastUploadAt, summary);
	}

	public ChatSession withSummary(ConversationSummary summary) {
		return new ChatSession(sessionId, key, turns, createdAt, lastActivity, persistedTurnIds,
			lastUploadAt, summary);
	}

	public boolean hasSummary() {
		return summary != null;
	}
}

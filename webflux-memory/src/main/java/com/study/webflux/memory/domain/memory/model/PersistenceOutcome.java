package com.study.webflux.memory.domain.memory.model;

import com.study.webflux.memory.domain.session.model.ChatSessionKey;

/**
 * 채팅 경계에서 수행한 업로드 결과입니다.
 */
public record PersistenceOutcome(
	ChatSessionKey key,
	Status status,
	int recordCount
) {
	public enum Status {
		NO_SESSION, EMPTY, COOLDOWN, UP_TO_DATE, PERSISTED, FAILED
	}

	public PersistenceOutcome {
		if (key == null) {
			throw new IllegalArgumentException("key cannot be null");
		}
		if (status == null) {
			throw new IllegalArgumentException("status cannot be null");
		}
	}

	public static PersistenceOutcome of(ChatSessionKey key, Status status) {
		return new PersistenceOutcome(key, status, 0);
	}

	public static PersistenceOutcome persisted(ChatSessionKey key, int recordCount) {
		return new PersistenceOutcome(key, Status.PERSISTED, recordCount);
	}

	public boolean isPersisted() {
		return status == Status.PERSISTED || status == Status.UP_TO_DATE;
	}
}

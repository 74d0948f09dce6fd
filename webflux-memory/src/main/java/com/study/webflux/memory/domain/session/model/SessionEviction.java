package com.study.webflux.memory.domain.session.model;

import java.util.List;

/**
 * 정리 스윕 결과입니다.
 *
 * @param evicted            영속화가 끝났거나 비어 있어 제거된 세션
 * @param pendingPersistence 비활성이지만 아직 업로드되지 않은 턴이 남은 세션
 * @param overdue            최대 보존 시간을 넘겼지만 미영속 턴 때문에 유지되는 세션
 */
public record SessionEviction(
	List<ChatSessionKey> evicted,
	List<ChatSessionKey> pendingPersistence,
	List<ChatSessionKey> overdue
) {
	public SessionEviction {
		evicted = evicted == null ? List.of() : List.copyOf(evicted);
		pendingPersistence = pendingPersistence == null ? List.of() : List.copyOf(pendingPersistence);
		overdue = overdue == null ? List.of() : List.copyOf(overdue);
	}

	public static SessionEviction empty() {
		return new SessionEviction(List.of(), List.of(), List.of());
	}

	public boolean isEmpty() {
		return evicted.isEmpty() && pendingPersistence.isEmpty() && overdue.isEmpty();
	}
}

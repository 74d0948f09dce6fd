package com.study.webflux.memory.domain.session.port;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import com.study.webflux.memory.domain.dialogue.model.UserId;
import com.study.webflux.memory.domain.session.model.ChatSession;
import com.study.webflux.memory.domain.session.model.ChatSessionKey;

/**
 * 프로세스 로컬 세션 저장소입니다.
 */
public interface ChatSessionRepository {

	Optional<ChatSession> findByKey(ChatSessionKey key);

	List<ChatSession> findByUser(UserId userId);

	List<ChatSession> findAll();

	/**
	 * key 단위로 원자적으로 세션을 갱신합니다. 세션이 없으면 remapping에 null이 전달되고, null을 반환하면 세션을 제거합니다.
	 */
	ChatSession compute(ChatSessionKey key, UnaryOperator<ChatSession> remapping);

	boolean delete(ChatSessionKey key);

	int deleteByUser(UserId userId);
}

package com.study.webflux.memory.infrastructure.session.adapter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

import org.springframework.stereotype.Component;

import com.study.webflux.memory.domain.dialogue.model.UserId;
import com.study.webflux.memory.domain.session.model.ChatSession;
import com.study.webflux.memory.domain.session.model.ChatSessionKey;
import com.study.webflux.memory.domain.session.port.ChatSessionRepository;

@Component
public class InMemoryChatSessionRepository implements ChatSessionRepository {

	private final ConcurrentMap<ChatSessionKey, ChatSession> sessions = new ConcurrentHashMap<>();

	@Override
	public Optional<ChatSession> findByKey(ChatSessionKey key) {
		return Optional.ofNullable(sessions.get(key));
	}

	@Override
	public List<ChatSession> findByUser(UserId userId) {
		return sessions.values().stream().filter(session -> session.userId().equals(userId)).toList();
	}

	@Override
	public List<ChatSession> findAll() {
		return new ArrayList<>(sessions.values());
	}

	@Override
	public ChatSession compute(ChatSessionKey key, UnaryOperator<ChatSession> remapping) {
		return sessions.compute(key, (ignored, current) -> remapping.apply(current));
	}

	@Override
	public boolean delete(ChatSessionKey key) {
		return sessions.remove(key) != null;
	}

	@Override
	public int deleteByUser(UserId userId) {
		List<ChatSessionKey> keys = sessions.keySet()
			.stream()
			.filter(key -> key.userId().equals(userId))
			.toList();
		int removed = 0;
		for (ChatSessionKey key : keys) {
			if (sessions.remove(key) != null) {
				removed++;
			}
		}
		return removed;
	}
}

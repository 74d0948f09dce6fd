package com.study.webflux.memory.application.session.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import com.study.webflux.memory.domain.dialogue.model.ChatId;
import com.study.webflux.memory.domain.dialogue.model.ConversationTurn;
import com.study.webflux.memory.domain.dialogue.model.TurnAttachment;
import com.study.webflux.memory.domain.dialogue.model.UserId;
import com.study.webflux.memory.domain.session.model.ChatSession;
import com.study.webflux.memory.domain.session.model.ChatSessionKey;
import com.study.webflux.memory.domain.session.model.ConversationSummary;
import com.study.webflux.memory.domain.session.model.SessionEviction;
import com.study.webflux.memory.domain.session.model.UploadClaim;
import com.study.webflux.memory.domain.session.port.ChatSessionRepository;
import com.study.webflux.memory.infrastructure.memory.config.properties.MemoryProperties;

/**
 * 진행 중인 채팅의 턴, 요약, 업로드 상태를 관리하는 세션 저장소 서비스입니다.
 *
 * <p>
 * 같은 (userId, chatId)에 대한 모든 변경은 저장소의 원자적 compute로 직렬화되므로 동시 append에서도 턴이 유실되지 않습니다.
 */
@Slf4j
@Service
public class SessionStoreService {

	private final ChatSessionRepository repository;
	private final Clock clock;
	private final Duration maxRetention;

	public SessionStoreService(ChatSessionRepository repository,
		Clock clock,
		MemoryProperties properties) {
		this.repository = repository;
		this.clock = clock;
		this.maxRetention = properties.getSession().getMaxRetention();
	}

	/**
	 * 현재 시각으로 새 턴을 만듭니다. 세션에는 아직 추가되지 않습니다.
	 */
	public ConversationTurn newTurn(UserId userId,
		ChatId chatId,
		String userPrompt,
		String aiResponse,
		TurnAttachment attachment) {
		return ConversationTurn.create(userId, chatId, userPrompt, aiResponse, clock.instant())
			.withAttachment(attachment);
	}

	/**
	 * 턴을 생성해 세션에 추가합니다. 세션이 없으면 새로 만듭니다.
	 */
	public ConversationTurn append(UserId userId,
		ChatId chatId,
		String userPrompt,
		String aiResponse,
		TurnAttachment attachment) {
		ConversationTurn turn = newTurn(userId, chatId, userPrompt, aiResponse, attachment);
		append(turn);
		return turn;
	}

	public ChatSession append(ConversationTurn turn) {
		ChatSessionKey key = ChatSessionKey.of(turn.userId(), turn.chatId());
		return repository.compute(key, current -> {
			ChatSession session = current;
			if (session == null) {
				session = ChatSession.start(key, clock.instant());
				log.info("새 채팅 세션 시작: userId={}, chatId={}", key.userId().value(),
					key.chatId().value());
			}
			return session.append(turn);
		});
	}

	public Optional<ChatSession> find(UserId userId, ChatId chatId) {
		return repository.findByKey(ChatSessionKey.of(userId, chatId));
	}

	public List<ChatSession> findByUser(UserId userId) {
		return repository.findByUser(userId);
	}

	/**
	 * 최근 턴을 시간 순서로 반환합니다. chatId가 없으면 사용자의 모든 채팅을 대상으로 합니다.
	 */
	public List<ConversationTurn> recent(UserId userId, ChatId chatId, int limit) {
		if (limit <= 0) {
			return List.of();
		}
		if (chatId != null) {
			return find(userId, chatId).map(session -> session.recentTurns(limit)).orElse(List.of());
		}
		List<ConversationTurn> all = repository.findByUser(userId)
			.stream()
			.flatMap(session -> session.turns().stream())
			.sorted(Comparator.comparing(ConversationTurn::timestamp))
			.toList();
		return all.subList(Math.max(0, all.size() - limit), all.size());
	}

	/**
	 * 저장된 채팅 요약을 최신순으로 반환합니다.
	 */
	public List<ConversationSummary> summaries(UserId userId, ChatId chatId) {
		List<ChatSession> sessions = chatId != null
			? find(userId, chatId).map(List::of).orElse(List.of())
			: repository.findByUser(userId);
		return sessions.stream()
			.filter(ChatSession::hasSummary)
			.map(ChatSession::summary)
			.sorted(Comparator.comparing(ConversationSummary::createdAt).reversed())
			.toList();
	}

	/**
	 * 업로드 권한을 원자적으로 선점합니다. 쿨다운 중이거나 세션이 없으면 빈 값을 반환합니다.
	 */
	public Optional<UploadClaim> beginUpload(ChatSessionKey key, boolean force, Duration cooldown) {
		Instant now = clock.instant();
		UploadClaim[] claim = new UploadClaim[1];
		repository.compute(key, current -> {
			if (current == null) {
				return null;
			}
			if (!force && current.isInCooldown(now, cooldown)) {
				return current;
			}
			ChatSession started = current.withUploadStartedAt(now);
			claim[0] = new UploadClaim(started, current.lastUploadAt());
			return started;
		});
		return Optional.ofNullable(claim[0]);
	}

	public void completeUpload(ChatSessionKey key,
		Collection<String> turnIds,
		ConversationSummary summary) {
		repository.compute(key, current -> {
			if (current == null) {
				return null;
			}
			ChatSession updated = current.withPersistedTurns(turnIds);
			return summary != null ? updated.withSummary(summary) : updated;
		});
	}

	/**
	 * 실패한 업로드의 쿨다운을 이전 값으로 되돌립니다.
	 */
	public void abortUpload(ChatSessionKey key, Instant previousUploadAt) {
		repository.compute(key,
			current -> current == null ? null : current.withUploadStartedAt(previousUploadAt));
	}

	public boolean remove(ChatSessionKey key) {
		return repository.delete(key);
	}

	public int removeUser(UserId userId) {
		return repository.deleteByUser(userId);
	}

	/**
	 * 비활성 세션을 정리합니다. 미영속 턴이 남은 세션은 제거하지 않고 업로드 대상으로 돌려줍니다.
	 */
	public SessionEviction evictStale(Duration maxAge) {
		Instant now = clock.instant();
		Instant inactiveBefore = now.minus(maxAge);
		Instant retentionLimit = now.minus(maxRetention);

		List<ChatSessionKey> evicted = new ArrayList<>();
		List<ChatSessionKey> pending = new ArrayList<>();
		List<ChatSessionKey> overdue = new ArrayList<>();

		for (ChatSession candidate : repository.findAll()) {
			if (!candidate.isInactiveSince(inactiveBefore)) {
				continue;
			}
			ChatSessionKey key = candidate.key();
			boolean[] removed = new boolean[1];
			ChatSession remaining = repository.compute(key, current -> {
				if (current == null) {
					return null;
				}
				boolean persistable = current.turns().isEmpty() || current.isPersisted();
				if (current.isInactiveSince(inactiveBefore) && persistable) {
					removed[0] = true;
					return null;
				}
				return current;
			});
			if (removed[0]) {
				evicted.add(key);
			} else if (remaining != null && remaining.isInactiveSince(inactiveBefore)) {
				pending.add(key);
				if (remaining.createdAt().isBefore(retentionLimit)) {
					overdue.add(key);
				}
			}
		}

		if (!overdue.isEmpty()) {
			log.warn("최대 보존 시간을 넘긴 미영속 세션: count={}, keys={}", overdue.size(),
				overdue.stream().map(ChatSessionKey::asString).toList());
		}
		return new SessionEviction(evicted, pending, overdue);
	}
}

package com.study.webflux.memory.infrastructure.memory.adapter.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.study.webflux.memory.domain.dialogue.model.ChatId;
import com.study.webflux.memory.domain.dialogue.model.UserId;
import com.study.webflux.memory.domain.memory.port.RecentContextCachePort;

import reactor.core.publisher.Mono;

/**
 * 프로세스 로컬 최근 대화 캐시입니다. 만료된 항목은 조회 시점에 제거됩니다.
 */
@Component
@ConditionalOnProperty(name = "memory.cache.type", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryRecentContextCacheAdapter implements RecentContextCachePort {

	private final Map<String, CachedContext> entries = new ConcurrentHashMap<>();
	private final Clock clock;

	public InMemoryRecentContextCacheAdapter(Clock clock) {
		this.clock = clock;
	}

	@Override
	public Mono<String> get(UserId userId, ChatId chatId) {
		return Mono.fromSupplier(() -> {
			String key = key(userId, chatId);
			CachedContext cached = entries.get(key);
			if (cached == null) {
				return null;
			}
			if (!cached.expiresAt().isAfter(clock.instant())) {
				entries.remove(key, cached);
				return null;
			}
			return cached.context();
		});
	}

	@Override
	public Mono<Void> put(UserId userId, ChatId chatId, String context, Duration ttl) {
		return Mono.fromRunnable(() -> entries.put(key(userId, chatId),
			new CachedContext(context, clock.instant().plus(ttl))));
	}

	@Override
	public Mono<Void> evict(UserId userId, ChatId chatId) {
		return Mono.fromRunnable(() -> entries.remove(key(userId, chatId)));
	}

	@Override
	public Mono<Void> evictUser(UserId userId) {
		String prefix = userId.value() + ":";
		return Mono.fromRunnable(() -> entries.keySet().removeIf(key -> key.startsWith(prefix)));
	}

	private static String key(UserId userId, ChatId chatId) {
		return userId.value() + ":" + chatId.value();
	}

	private record CachedContext(String context, Instant expiresAt) {
	}
}

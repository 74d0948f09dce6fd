package com.study.webflux.memory.infrastructure.memory.adapter.cache;

import java.time.Duration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;

import com.study.webflux.memory.domain.dialogue.model.ChatId;
import com.study.webflux.memory.domain.dialogue.model.UserId;
import com.study.webflux.memory.domain.memory.port.RecentContextCachePort;
import com.study.webflux.memory.infrastructure.memory.config.properties.MemoryProperties;

import reactor.core.publisher.Mono;

/**
 * 여러 인스턴스가 공유하는 Redis 기반 최근 대화 캐시입니다. 만료는 Redis TTL에 맡깁니다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "memory.cache.type", havingValue = "redis")
public class RedisRecentContextCacheAdapter implements RecentContextCachePort {

	private final ReactiveRedisTemplate<String, String> redisTemplate;
	private final String keyPrefix;

	public RedisRecentContextCacheAdapter(
		@Qualifier("recentContextRedisTemplate") ReactiveRedisTemplate<String, String> redisTemplate,
		MemoryProperties properties) {
		this.redisTemplate = redisTemplate;
		this.keyPrefix = properties.getCache().getKeyPrefix();
	}

	@Override
	public Mono<String> get(UserId userId, ChatId chatId) {
		return redisTemplate.opsForValue().get(key(userId, chatId));
	}

	@Override
	public Mono<Void> put(UserId userId, ChatId chatId, String context, Duration ttl) {
		return redisTemplate.opsForValue().set(key(userId, chatId), context, ttl).then();
	}

	@Override
	public Mono<Void> evict(UserId userId, ChatId chatId) {
		return redisTemplate.delete(key(userId, chatId)).then();
	}

	@Override
	public Mono<Void> evictUser(UserId userId) {
		ScanOptions options = ScanOptions.scanOptions()
			.match(keyPrefix + userId.value() + ":*")
			.build();
		return redisTemplate.scan(options)
			.flatMap(key -> redisTemplate.delete(key))
			.reduce(0L, Long::sum)
			.doOnNext(deleted -> log.debug("사용자 캐시 키 삭제: userId={}, count={}", userId.value(),
				deleted))
			.then();
	}

	private String key(UserId userId, ChatId chatId) {
		return keyPrefix + userId.value() + ":" + chatId.value();
	}
}

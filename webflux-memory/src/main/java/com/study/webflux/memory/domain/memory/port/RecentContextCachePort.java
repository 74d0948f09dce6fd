package com.study.webflux.memory.domain.memory.port;

import java.time.Duration;

import com.study.webflux.memory.domain.dialogue.model.ChatId;
import com.study.webflux.memory.domain.dialogue.model.UserId;

import reactor.core.publisher.Mono;

/**
 * 채팅별로 렌더링된 최근 대화 문맥을 짧게 보관하는 캐시입니다.
 */
public interface RecentContextCachePort {

	Mono<String> get(UserId userId, ChatId chatId);

	Mono<Void> put(UserId userId, ChatId chatId, String context, Duration ttl);

	Mono<Void> evict(UserId userId, ChatId chatId);

	Mono<Void> evictUser(UserId userId);
}

package com.study.webflux.memory.infrastructure.memory.adapter.cache;

import java.time.Duration;

import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.data.redis.core.ScanOptions;

import com.study.webflux.memory.domain.dialogue.model.ChatId;
import com.study.webflux.memory.domain.dialogue.model.UserId;
import com.study.webflux.memory.fixture.MemoryPropertiesFixture;
import com.study.webflux.memory.fixture.UserIdFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisRecentContextCacheAdapterTest {

	private static final String KEY = "memory:context:user-1:chat-1";

	@Mock
	private ReactiveRedisTemplate<String, String> redisTemplate;

	@Mock
	private ReactiveValueOperations<String, String> valueOps;

	private RedisRecentContextCacheAdapter adapter;

	private final UserId userId = UserIdFixture.create();
	private final ChatId chatId = UserIdFixture.chat();

	@BeforeEach
	void setUp() {
		adapter = new RedisRecentContextCacheAdapter(redisTemplate, MemoryPropertiesFixture.create());
	}

	@Test
	@DisplayName("TTL과 함께 SET 실행")
	void put_setsWithTtl() {
		Duration ttl = Duration.ofMinutes(2);
		when(redisTemplate.opsForValue()).thenReturn(valueOps);
		when(valueOps.set(KEY, "recent", ttl)).thenReturn(Mono.just(true));

		StepVerifier.create(adapter.put(userId, chatId, "recent", ttl)).verifyComplete();

		verify(valueOps).set(KEY, "recent", ttl);
	}

	@Test
	@DisplayName("키가 없으면 비어 있음")
	void get_missingKey_isEmpty() {
		when(redisTemplate.opsForValue()).thenReturn(valueOps);
		when(valueOps.get(KEY)).thenReturn(Mono.empty());

		StepVerifier.create(adapter.get(userId, chatId)).verifyComplete();
	}

	@Test
	@DisplayName("사용자 키를 SCAN으로 찾아 모두 삭제")
	void evictUser_scansAndDeletes() {
		when(redisTemplate.scan(any(ScanOptions.class)))
			.thenReturn(Flux.just(KEY, "memory:context:user-1:chat-2"));
		when(redisTemplate.delete(KEY)).thenReturn(Mono.just(1L));
		when(redisTemplate.delete("memory:context:user-1:chat-2")).thenReturn(Mono.just(1L));
		ArgumentCaptor<ScanOptions> optionsCaptor = ArgumentCaptor.forClass(ScanOptions.class);

		StepVerifier.create(adapter.evictUser(userId)).verifyComplete();

		verify(redisTemplate).scan(optionsCaptor.capture());
		assertThat(optionsCaptor.getValue().getPattern()).isEqualTo("memory:context:user-1:*");
		verify(redisTemplate).delete("memory:context:user-1:chat-2");
	}
}

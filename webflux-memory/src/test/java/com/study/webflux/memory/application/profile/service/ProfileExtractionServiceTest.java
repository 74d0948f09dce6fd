package com.study.webflux.memory.application.profile.service;

import java.time.Duration;
import java.util.List;

import com.study.webflux.memory.application.memory.support.MemoryTaskExecutor;
import com.study.webflux.memory.domain.dialogue.model.UserId;
import com.study.webflux.memory.domain.memory.service.MemoryContextFormatter;
import com.study.webflux.memory.domain.profile.model.ProfileUpdate;
import com.study.webflux.memory.domain.profile.port.ProfileExtractionPort;
import com.study.webflux.memory.domain.session.model.ChatSession;
import com.study.webflux.memory.fixture.ChatSessionFixture;
import com.study.webflux.memory.fixture.MemoryPropertiesFixture;
import com.study.webflux.memory.fixture.MutableClock;
import com.study.webflux.memory.fixture.UserIdFixture;
import com.study.webflux.memory.fixture.UserProfileFixture;
import com.study.webflux.memory.infrastructure.memory.config.properties.MemoryProperties;
import com.study.webflux.memory.infrastructure.monitoring.config.MemoryMetricsConfiguration;
import com.study.webflux.memory.infrastructure.profile.adapter.InMemoryUserProfileRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProfileExtractionServiceTest {

	@Mock
	private ProfileExtractionPort extractionPort;

	private SimpleMeterRegistry meterRegistry;
	private UserProfileService profileService;
	private ProfileExtractionService extractionService;

	private final UserId userId = UserIdFixture.create();

	@BeforeEach
	void setUp() {
		MutableClock clock = MutableClock.create();
		meterRegistry = new SimpleMeterRegistry();
		MemoryMetricsConfiguration metrics = new MemoryMetricsConfiguration(meterRegistry);
		profileService = new UserProfileService(new InMemoryUserProfileRepository(),
			new MemoryContextFormatter(clock), clock);
		MemoryTaskExecutor taskExecutor = new MemoryTaskExecutor(Schedulers.immediate(),
			Duration.ofSeconds(5), metrics);
		extractionService = new ProfileExtractionService(extractionPort, profileService,
			taskExecutor, metrics, MemoryPropertiesFixture.create());
	}

	@Test
	@DisplayName("세 번째 턴에서 추출을 실행하고 프로필에 병합")
	void onTurnAppended_thirdTurn_mergesProfile() {
		ChatSession session = ChatSessionFixture.withTurns(3);
		when(extractionPort.extract(session.turns()))
			.thenReturn(Mono.just(UserProfileFixture.alexUpdate()));

		boolean triggered = extractionService.onTurnAppended(session);

		assertThat(triggered).isTrue();
		assertThat(profileService.get(userId)).hasValueSatisfying(profile -> {
			assertThat(profile.name()).isEqualTo("Alex");
			assertThat(profile.interests()).contains("pricing");
			assertThat(profile.conversationCount()).isEqualTo(1);
		});
		assertThat(meterRegistry.get("memory.profile.extraction.success").counter().count())
			.isEqualTo(1.0);
	}

	@Test
	@DisplayName("추출 주기가 아니면 실행하지 않음")
	void onTurnAppended_offInterval_doesNothing() {
		assertThat(extractionService.onTurnAppended(ChatSessionFixture.withTurns(2))).isFalse();
		assertThat(extractionService.onTurnAppended(ChatSessionFixture.empty())).isFalse();

		verify(extractionPort, never()).extract(anyList());
	}

	@Test
	@DisplayName("추출 실패 시 기존 프로필 유지")
	void extractAndMerge_failure_keepsProfile() {
		profileService.upsert(userId, UserProfileFixture.alexUpdate());
		ChatSession session = ChatSessionFixture.withTurns(3);
		when(extractionPort.extract(session.turns()))
			.thenReturn(Mono.error(new IllegalStateException("LLM down")));

		StepVerifier.create(extractionService.extractAndMerge(userId, session.turns()))
			.verifyComplete();

		assertThat(profileService.get(userId).orElseThrow().conversationCount()).isEqualTo(1);
		assertThat(meterRegistry.get("memory.profile.extraction.failure").counter().count())
			.isEqualTo(1.0);
	}

	@Test
	@DisplayName("빈 추출 결과는 병합하지 않음")
	void extractAndMerge_emptyUpdate_isIgnored() {
		when(extractionPort.extract(anyList())).thenReturn(Mono.just(ProfileUpdate.empty()));

		StepVerifier.create(extractionService.extractAndMerge(userId, List.of()))
			.verifyComplete();

		assertThat(profileService.get(userId)).isEmpty();
	}

	@Test
	@DisplayName("추출 주기 설정 반영")
	void customInterval_isApplied() {
		MemoryProperties properties = MemoryPropertiesFixture.create();
		properties.getProfile().setExtractionInterval(1);
		MemoryMetricsConfiguration metrics = new MemoryMetricsConfiguration(meterRegistry);
		ProfileExtractionService everyTurn = new ProfileExtractionService(extractionPort,
			profileService, new MemoryTaskExecutor(Schedulers.immediate(), Duration.ofSeconds(5),
				metrics), metrics, properties);
		when(extractionPort.extract(anyList())).thenReturn(Mono.empty());

		assertThat(everyTurn.onTurnAppended(ChatSessionFixture.withTurns(1))).isTrue();
	}
}

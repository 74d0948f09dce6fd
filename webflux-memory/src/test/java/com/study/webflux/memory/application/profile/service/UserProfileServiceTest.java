package com.study.webflux.memory.application.profile.service;

import java.time.Duration;
import java.util.Set;

import com.study.webflux.memory.domain.dialogue.model.UserId;
import com.study.webflux.memory.domain.memory.service.MemoryContextFormatter;
import com.study.webflux.memory.domain.profile.model.ProfileUpdate;
import com.study.webflux.memory.domain.profile.model.UserProfile;
import com.study.webflux.memory.fixture.MutableClock;
import com.study.webflux.memory.fixture.UserIdFixture;
import com.study.webflux.memory.fixture.UserProfileFixture;
import com.study.webflux.memory.infrastructure.profile.adapter.InMemoryUserProfileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UserProfileServiceTest {

	private MutableClock clock;
	private UserProfileService profileService;

	private final UserId userId = UserIdFixture.create();

	@BeforeEach
	void setUp() {
		clock = MutableClock.create();
		profileService = new UserProfileService(new InMemoryUserProfileRepository(),
			new MemoryContextFormatter(clock), clock);
	}

	@Test
	@DisplayName("프로필이 없으면 새로 만들어 병합")
	void upsert_createsProfile() {
		UserProfile profile = profileService.upsert(userId, UserProfileFixture.alexUpdate());

		assertThat(profile.name()).isEqualTo("Alex");
		assertThat(profile.conversationCount()).isZero();
		assertThat(profileService.get(userId)).contains(profile);
	}

	@Test
	@DisplayName("반복 병합 시 관심사가 누적되고 이름은 유지")
	void upsert_accumulates() {
		profileService.upsert(userId, UserProfileFixture.alexUpdate());
		clock.advance(Duration.ofMinutes(10));

		UserProfile profile = profileService.upsert(userId,
			new ProfileUpdate(null, null, "startup founder", Set.of("hiring"), Set.of("concise answers"),
				null));

		assertThat(profile.name()).isEqualTo("Alex");
		assertThat(profile.background()).isEqualTo("startup founder");
		assertThat(profile.interests()).containsExactlyInAnyOrder("pricing", "hiring");
		assertThat(profile.conversationCount()).isZero();
		assertThat(profile.lastUpdated()).isEqualTo(clock.instant());
	}

	@Test
	@DisplayName("직접 수정은 대화 수를 바꾸지 않고 추출 병합만 대화 수를 증가")
	void mergeExtracted_countsOnlyExtractions() {
		profileService.mergeExtracted(userId, UserProfileFixture.alexUpdate());
		profileService.upsert(userId, new ProfileUpdate(null, "designer", null, Set.of(), Set.of(),
			null));
		UserProfile profile = profileService.mergeExtracted(userId,
			new ProfileUpdate(null, null, null, Set.of("hiring"), Set.of(), null));

		assertThat(profile.conversationCount()).isEqualTo(2);
		assertThat(profile.role()).isEqualTo("designer");
		assertThat(profile.interests()).contains("pricing", "hiring");
	}

	@Test
	@DisplayName("프로필 컨텍스트 생성, 없으면 빈 문자열")
	void generateContext_rendersProfile() {
		assertThat(profileService.generateContext(userId)).isEmpty();

		profileService.upsert(userId, UserProfileFixture.alexUpdate());

		assertThat(profileService.generateContext(userId)).contains("The user's name is Alex.");
	}

	@Test
	@DisplayName("잘못된 인자 거부")
	void upsert_rejectsNulls() {
		assertThatThrownBy(() -> profileService.upsert(null, ProfileUpdate.empty()))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> profileService.upsert(userId, null))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("프로필 삭제")
	void delete_removesProfile() {
		profileService.upsert(userId, UserProfileFixture.alexUpdate());

		assertThat(profileService.delete(userId)).isTrue();
		assertThat(profileService.get(userId)).isEmpty();
		assertThat(profileService.all()).isEmpty();
	}
}

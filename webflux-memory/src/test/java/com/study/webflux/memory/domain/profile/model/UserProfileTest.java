package com.study.webflux.memory.domain.profile.model;

import java.time.Instant;
import java.util.Set;

import com.study.webflux.memory.fixture.UserProfileFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UserProfileTest {

	private static final Instant LATER = Instant.parse("2025-01-16T09:00:00Z");

	@Test
	@DisplayName("병합 시 관심사와 선호는 합집합으로 누적")
	void merge_unionsSets() {
		UserProfile profile = UserProfileFixture.alex();
		ProfileUpdate update = new ProfileUpdate(null, null, null, Set.of("hiking"),
			Set.of("short answers"), null);

		UserProfile merged = profile.merge(update, LATER);

		assertThat(merged.interests()).containsExactlyInAnyOrder("pricing", "hiking");
		assertThat(merged.preferences()).containsExactly("short answers");
	}

	@Test
	@DisplayName("비어 있는 추출값은 기존 값을 지우지 않음")
	void merge_emptyValues_keepExisting() {
		UserProfile profile = UserProfileFixture.alex();

		UserProfile merged = profile.merge(ProfileUpdate.empty(), LATER);

		assertThat(merged.name()).isEqualTo("Alex");
		assertThat(merged.role()).isEqualTo("product manager");
		assertThat(merged.interests()).containsExactly("pricing");
	}

	@Test
	@DisplayName("비어 있지 않은 스칼라 값은 덮어씀")
	void merge_nonEmptyScalar_overwrites() {
		UserProfile profile = UserProfileFixture.alex();
		ProfileUpdate update = new ProfileUpdate(null, "head of product", "Works at Acme", Set.of(),
			Set.of(), "direct");

		UserProfile merged = profile.merge(update, LATER);

		assertThat(merged.role()).isEqualTo("head of product");
		assertThat(merged.background()).isEqualTo("Works at Acme");
		assertThat(merged.conversationStyle()).isEqualTo("direct");
		assertThat(merged.name()).isEqualTo("Alex");
	}

	@Test
	@DisplayName("직접 병합은 conversationCount를 유지하고 lastUpdated만 갱신")
	void merge_keepsCountAndUpdatesTimestamp() {
		UserProfile profile = UserProfileFixture.alex();

		UserProfile merged = profile.merge(ProfileUpdate.empty(), LATER);

		assertThat(merged.conversationCount()).isEqualTo(profile.conversationCount());
		assertThat(merged.lastUpdated()).isEqualTo(LATER);
		assertThat(merged.createdAt()).isEqualTo(profile.createdAt());
	}

	@Test
	@DisplayName("추출 결과 병합은 conversationCount 증가")
	void mergeExtracted_incrementsCount() {
		UserProfile profile = UserProfileFixture.alex();

		UserProfile merged = profile.mergeExtracted(ProfileUpdate.empty(), LATER);

		assertThat(merged.conversationCount()).isEqualTo(profile.conversationCount() + 1);
		assertThat(merged.lastUpdated()).isEqualTo(LATER);
		assertThat(merged.name()).isEqualTo(profile.name());
	}

	@Test
	@DisplayName("추출값의 공백과 \"null\" 문자열은 무시")
	void profileUpdate_normalizesBlankAndNullStrings() {
		ProfileUpdate update = new ProfileUpdate("null", "  ", " Alex ", Set.of("", "tennis"),
			null, null);

		assertThat(update.name()).isNull();
		assertThat(update.role()).isNull();
		assertThat(update.background()).isEqualTo("Alex");
		assertThat(update.interests()).containsExactly("tennis");
		assertThat(update.preferences()).isEmpty();
		assertThat(ProfileUpdate.empty().isEmpty()).isTrue();
	}

	@Test
	@DisplayName("새 프로필은 내용이 없음")
	void create_hasNoContent() {
		assertThat(UserProfileFixture.empty().hasContent()).isFalse();
		assertThat(UserProfileFixture.alex().hasContent()).isTrue();
	}
}

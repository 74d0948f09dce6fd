package com.study.webflux.memory.domain.profile.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.study.webflux.memory.domain.dialogue.model.UserId;

/**
 * 사용자별 누적 프로필입니다. interests와 preferences는 병합을 거치며 줄어들지 않습니다.
 */
public record UserProfile(
	UserId userId,
	String name,
	String role,
	String background,
	Set<String> interests,
	Set<String> preferences,
	String conversationStyle,
	int conversationCount,
	Instant createdAt,
	Instant lastUpdated
) {
	public UserProfile {
		if (userId == null) {
			throw new IllegalArgumentException("userId cannot be null");
		}
		if (conversationCount < 0) {
			throw new IllegalArgumentException("conversationCount cannot be negative");
		}
		if (createdAt == null) {
			throw new IllegalArgumentException("createdAt cannot be null");
		}
		interests = interests == null
			? Set.of()
			: Collections.unmodifiableSet(new LinkedHashSet<>(interests));
		preferences = preferences == null
			? Set.of()
			: Collections.unmodifiableSet(new LinkedHashSet<>(preferences));
		if (lastUpdated == null) {
			lastUpdated = createdAt;
		}
	}

	public static UserProfile create(UserId userId, Instant now) {
		return new UserProfile(userId, null, null, null, Set.of(), Set.of(), null, 0, now, now);
	}

	/**
	 * 값을 병합합니다. 스칼라 값은 비어 있지 않을 때만 덮어쓰고, 집합은 합집합으로 누적합니다. conversationCount는 바꾸지 않습니다.
	 */
	public UserProfile merge(ProfileUpdate update, Instant now) {
		return merge(update, now, conversationCount);
	}

	/**
	 * 대화에서 추출한 결과를 병합하고 conversationCount를 1 늘립니다.
	 */
	public UserProfile mergeExtracted(ProfileUpdate update, Instant now) {
		return merge(update, now, conversationCount + 1);
	}

	private UserProfile merge(ProfileUpdate update, Instant now, int count) {
		Set<String> mergedInterests = new LinkedHashSet<>(interests);
		mergedInterests.addAll(update.interests());
		Set<String> mergedPreferences = new LinkedHashSet<>(preferences);
		mergedPreferences.addAll(update.preferences());

		return new UserProfile(userId,
			update.name() != null ? update.name() : name,
			update.role() != null ? update.role() : role,
			update.background() != null ? update.background() : background,
			mergedInterests,
			mergedPreferences,
			update.conversationStyle() != null ? update.conversationStyle() : conversationStyle,
			count,
			createdAt,
			now);
	}

	public boolean hasContent() {
		return name != null || role != null || background != null || conversationStyle != null
			|| !interests.isEmpty() || !preferences.isEmpty();
	}
}

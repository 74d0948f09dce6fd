package com.study.webflux.memory.fixture;

import java.util.Set;

import com.study.webflux.memory.domain.profile.model.ProfileUpdate;
import com.study.webflux.memory.domain.profile.model.UserProfile;

public final class UserProfileFixture {

	private UserProfileFixture() {
	}

	public static UserProfile empty() {
		return UserProfile.create(UserIdFixture.create(), MutableClock.DEFAULT_START);
	}

	public static UserProfile alex() {
		return empty().merge(alexUpdate(), MutableClock.DEFAULT_START);
	}

	public static ProfileUpdate alexUpdate() {
		return new ProfileUpdate("Alex", "product manager", null, Set.of("pricing"), Set.of(),
			null);
	}
}

package com.study.webflux.memory.infrastructure.profile.adapter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;

import org.springframework.stereotype.Component;

import com.study.webflux.memory.domain.dialogue.model.UserId;
import com.study.webflux.memory.domain.profile.model.UserProfile;
import com.study.webflux.memory.domain.profile.port.UserProfileRepository;

@Component
public class InMemoryUserProfileRepository implements UserProfileRepository {

	private final ConcurrentMap<UserId, UserProfile> profiles = new ConcurrentHashMap<>();

	@Override
	public Optional<UserProfile> findByUserId(UserId userId) {
		return Optional.ofNullable(profiles.get(userId));
	}

	@Override
	public List<UserProfile> findAll() {
		return new ArrayList<>(profiles.values());
	}

	@Override
	public UserProfile compute(UserId userId, UnaryOperator<UserProfile> remapping) {
		return profiles.compute(userId, (ignored, current) -> remapping.apply(current));
	}

	@Override
	public boolean delete(UserId userId) {
		return profiles.remove(userId) != null;
	}
}

package com.study.webflux.memory.domain.profile.port;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

import com.study.webflux.memory.domain.dialogue.model.UserId;
import com.study.webflux.memory.domain.profile.model.UserProfile;

public interface UserProfileRepository {

	Optional<UserProfile> findByUserId(UserId userId);

	List<UserProfile> findAll();

	/**
	 * 사용자 단위로 원자적으로 프로필을 갱신합니다. 프로필이 없으면 remapping에 null이 전달됩니다.
	 */
	UserProfile compute(UserId userId, UnaryOperator<UserProfile> remapping);

	boolean delete(UserId userId);
}

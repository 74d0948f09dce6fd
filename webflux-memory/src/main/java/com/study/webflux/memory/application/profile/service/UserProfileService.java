package com.study.webflux.memory.application.profile.service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import com.study.webflux.memory.domain.dialogue.model.UserId;
import com.study.webflux.memory.domain.memory.service.MemoryContextFormatter;
import com.study.webflux.memory.domain.profile.model.ProfileUpdate;
import com.study.webflux.memory.domain.profile.model.UserProfile;
import com.study.webflux.memory.domain.profile.port.UserProfileRepository;

/** 사용자 프로필 조회, 병합, 렌더링을 담당합니다. */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserProfileService {

	private final UserProfileRepository repository;
	private final MemoryContextFormatter formatter;
	private final Clock clock;

	public Optional<UserProfile> get(UserId userId) {
		return repository.findByUserId(userId);
	}

	/**
	 * 값을 기존 프로필에 직접 병합합니다. 프로필이 없으면 새로 만들며 conversationCount는 바꾸지 않습니다.
	 */
	public UserProfile upsert(UserId userId, ProfileUpdate update) {
		return apply(userId, update, false);
	}

	/**
	 * 대화에서 추출한 결과를 병합하고 conversationCount를 늘립니다.
	 */
	public UserProfile mergeExtracted(UserId userId, ProfileUpdate update) {
		return apply(userId, update, true);
	}

	private UserProfile apply(UserId userId, ProfileUpdate update, boolean extracted) {
		if (userId == null) {
			throw new IllegalArgumentException("userId cannot be null");
		}
		if (update == null) {
			throw new IllegalArgumentException("update cannot be null");
		}
		UserProfile merged = repository.compute(userId, current -> {
			UserProfile base = current != null ? current : UserProfile.create(userId, clock.instant());
			return extracted
				? base.mergeExtracted(update, clock.instant())
				: base.merge(update, clock.instant());
		});
		log.debug("프로필 병합 완료: userId={}, interests={}, preferences={}, count={}",
			userId.value(), merged.interests().size(), merged.preferences().size(),
			merged.conversationCount());
		return merged;
	}

	/**
	 * 프롬프트용 프로필 블록을 반환합니다. 알려진 정보가 없으면 빈 문자열입니다.
	 */
	public String generateContext(UserId userId) {
		return repository.findByUserId(userId).map(formatter::renderProfile).orElse("");
	}

	public boolean delete(UserId userId) {
		return repository.delete(userId);
	}

	public List<UserProfile> all() {
		return repository.findAll();
	}
}

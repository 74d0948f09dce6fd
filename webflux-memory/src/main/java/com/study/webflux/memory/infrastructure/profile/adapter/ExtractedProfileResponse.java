package com.study.webflux.memory.infrastructure.profile.adapter;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.study.webflux.memory.domain.profile.model.ProfileUpdate;

/** LLM이 반환하는 프로필 추출 JSON 형식입니다. */
@JsonIgnoreProperties(ignoreUnknown = true)
record ExtractedProfileResponse(
	String name,
	String role,
	List<String> interests,
	List<String> preferences,
	String background,
	String conversationStyle
) {
	ProfileUpdate toProfileUpdate() {
		return new ProfileUpdate(name, role, background,
			interests == null ? Set.of() : new LinkedHashSet<>(interests),
			preferences == null ? Set.of() : new LinkedHashSet<>(preferences),
			conversationStyle);
	}
}

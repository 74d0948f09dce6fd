package com.study.webflux.memory.domain.profile.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 대화에서 추출된 부분 프로필입니다. 비어 있는 필드는 병합 시 무시됩니다.
 */
public record ProfileUpdate(
	String name,
	String role,
	String background,
	Set<String> interests,
	Set<String> preferences,
	String conversationStyle
) {
	public ProfileUpdate {
		name = normalize(name);
		role = normalize(role);
		background = normalize(background);
		conversationStyle = normalize(conversationStyle);
		interests = normalizeAll(interests);
		preferences = normalizeAll(preferences);
	}

	public static ProfileUpdate empty() {
		return new ProfileUpdate(null, null, null, Set.of(), Set.of(), null);
	}

	public boolean isEmpty() {
		return name == null && role == null && background == null && conversationStyle == null
			&& interests.isEmpty() && preferences.isEmpty();
	}

	private static String normalize(String value) {
		if (value == null) {
			return null;
		}
		String trimmed = value.trim();
		if (trimmed.isEmpty() || "null".equalsIgnoreCase(trimmed)) {
			return null;
		}
		return trimmed;
	}

	private static Set<String> normalizeAll(Set<String> values) {
		if (values == null || values.isEmpty()) {
			return Set.of();
		}
		Set<String> normalized = new LinkedHashSet<>();
		for (String value : values) {
			String item = normalize(value);
			if (item != null) {
				normalized.add(item);
			}
		}
		return Collections.unmodifiableSet(normalized);
	}
}

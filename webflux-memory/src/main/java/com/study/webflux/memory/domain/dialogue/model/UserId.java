package com.study.webflux.memory.domain.dialogue.model;

public record UserId(
	String value
) {
	public UserId {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException("userId cannot be null or blank");
		}
		if (value.length() > 128) {
			throw new IllegalArgumentException("userId too long");
		}
	}

	public static UserId of(String value) {
		return new UserId(value);
	}
}

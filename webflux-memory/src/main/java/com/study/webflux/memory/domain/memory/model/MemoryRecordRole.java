package com.study.webflux.memory.domain.memory.model;

public enum MemoryRecordRole {
	USER("user"), ASSISTANT("assistant"), SUMMARY("summary");

	private final String value;

	MemoryRecordRole(String value) {
		this.value = value;
	}

	public String value() {
		return value;
	}

	public static MemoryRecordRole fromValue(String value) {
		for (MemoryRecordRole role : values()) {
			if (role.value.equalsIgnoreCase(value)) {
				return role;
			}
		}
		throw new IllegalArgumentException("Unknown memory record role: " + value);
	}
}

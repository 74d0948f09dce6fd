package com.study.webflux.memory.infrastructure.profile.adapter;

public record ProfileExtractionConfig(
	String model
) {
	public ProfileExtractionConfig {
		if (model == null || model.isBlank()) {
			throw new IllegalArgumentException("model cannot be null or blank");
		}
	}
}

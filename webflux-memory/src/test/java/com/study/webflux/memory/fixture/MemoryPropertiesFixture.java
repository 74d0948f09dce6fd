package com.study.webflux.memory.fixture;

import com.study.webflux.memory.infrastructure.memory.config.properties.MemoryProperties;

public final class MemoryPropertiesFixture {

	private MemoryPropertiesFixture() {
	}

	public static MemoryProperties create() {
		return new MemoryProperties();
	}
}

package com.study.webflux.memory.domain.memory.model;

import java.util.ArrayList;
import java.util.List;

public record MemoryEmbedding(
	String text,
	List<Float> vector
) {
	public MemoryEmbedding {
		if (text == null) {
			throw new IllegalArgumentException("text cannot be null");
		}
		if (vector == null || vector.isEmpty()) {
			throw new IllegalArgumentException("vector cannot be null or empty");
		}
		vector = List.copyOf(vector);
	}

	public static MemoryEmbedding of(String text, float[] vector) {
		if (vector == null) {
			throw new IllegalArgumentException("vector cannot be null or empty");
		}
		List<Float> values = new ArrayList<>(vector.length);
		for (float value : vector) {
			values.add(value);
		}
		return new MemoryEmbedding(text, values);
	}

	public int dimension() {
		return vector.size();
	}
}

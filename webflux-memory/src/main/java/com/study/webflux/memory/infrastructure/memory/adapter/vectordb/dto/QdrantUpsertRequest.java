package com.study.webflux.memory.infrastructure.memory.adapter.vectordb.dto;

import java.util.List;

public record QdrantUpsertRequest(
	List<QdrantPoint> points
) {
}

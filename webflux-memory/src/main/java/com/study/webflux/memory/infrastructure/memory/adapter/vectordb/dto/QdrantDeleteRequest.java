package com.study.webflux.memory.infrastructure.memory.adapter.vectordb.dto;

public record QdrantDeleteRequest(
	QdrantFilter filter
) {
}

package com.study.webflux.memory.infrastructure.memory.adapter.vectordb.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QdrantScoredPoint(
	String id,
	float score,
	Map<String, Object> payload
) {
}

package com.study.webflux.memory.infrastructure.memory.adapter.vectordb.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QdrantOperationResponse(
	Result result,
	String status
) {
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record Result(
		@JsonProperty("operation_id") Long operationId,
		String status
	) {
	}
}

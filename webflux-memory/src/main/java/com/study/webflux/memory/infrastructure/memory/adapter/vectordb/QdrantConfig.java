package com.study.webflux.memory.infrastructure.memory.adapter.vectordb;

public record QdrantConfig(
	String url,
	String apiKey,
	String collectionName,
	int vectorDimension,
	boolean autoCreateCollection
) {
	public QdrantConfig {
		if (url == null || url.isBlank()) {
			throw new IllegalArgumentException("url cannot be null or blank");
		}
		if (collectionName == null || collectionName.isBlank()) {
			throw new IllegalArgumentException("collectionName cannot be null or blank");
		}
		if (vectorDimension <= 0) {
			throw new IllegalArgumentException("vectorDimension must be positive");
		}
		if (url.endsWith("/")) {
			url = url.substring(0, url.length() - 1);
		}
	}

	public boolean hasApiKey() {
		return apiKey != null && !apiKey.isBlank();
	}
}

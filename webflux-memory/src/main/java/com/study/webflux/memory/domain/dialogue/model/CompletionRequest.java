package com.study.webflux.memory.domain.dialogue.model;

import java.util.List;
import java.util.Map;

/**
 * 단일 응답 LLM 호출 요청입니다. model이 비어 있으면 어댑터 기본 모델을 사용합니다.
 */
public record CompletionRequest(
	List<Message> messages,
	String model,
	Map<String, Object> additionalParams
) {
	public CompletionRequest {
		if (messages == null || messages.isEmpty()) {
			throw new IllegalArgumentException("messages cannot be null or empty");
		}
		messages = List.copyOf(messages);
		additionalParams = additionalParams == null ? Map.of() : Map.copyOf(additionalParams);
	}

	public static CompletionRequest withMessages(List<Message> messages, String model) {
		return new CompletionRequest(messages, model, Map.of());
	}

	public static CompletionRequest of(String prompt, String model) {
		return withMessages(List.of(Message.user(prompt)), model);
	}
}

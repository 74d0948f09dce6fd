package com.study.webflux.memory.domain.dialogue.model;

/**
 * 어시스턴트 응답에 함께 생성된 이미지 첨부 정보입니다.
 */
public record TurnAttachment(
	String url,
	String prompt
) {
	public TurnAttachment {
		if (url == null || url.isBlank()) {
			throw new IllegalArgumentException("url cannot be null or blank");
		}
	}

	public static TurnAttachment of(String url, String prompt) {
		return new TurnAttachment(url, prompt);
	}
}

package com.study.webflux.memory.domain.session.model;

import java.time.Instant;

/**
 * 업로드 권한을 선점한 결과입니다. 실패 시 previousUploadAt으로 쿨다운을 되돌립니다.
 */
public record UploadClaim(
	ChatSession session,
	Instant previousUploadAt
) {
	public UploadClaim {
		if (session == null) {
			throw new IllegalArgumentException("session cannot be null");
		}
	}
}

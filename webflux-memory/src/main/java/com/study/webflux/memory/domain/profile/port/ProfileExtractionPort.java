package com.study.webflux.memory.domain.profile.port;

import java.util.List;

import com.study.webflux.memory.domain.dialogue.model.ConversationTurn;
import com.study.webflux.memory.domain.profile.model.ProfileUpdate;

import reactor.core.publisher.Mono;

public interface ProfileExtractionPort {

	/**
	 * 대화 전체에서 사용자 정보를 추출합니다. 결과를 해석할 수 없으면 빈 Mono를 반환합니다.
	 */
	Mono<ProfileUpdate> extract(List<ConversationTurn> turns);
}

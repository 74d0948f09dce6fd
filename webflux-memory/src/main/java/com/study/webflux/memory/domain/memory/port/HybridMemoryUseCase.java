package com.study.webflux.memory.domain.memory.port;

import java.util.List;

import com.study.webflux.memory.domain.dialogue.model.ChatId;
import com.study.webflux.memory.domain.dialogue.model.ConversationTurn;
import com.study.webflux.memory.domain.dialogue.model.TurnAttachment;
import com.study.webflux.memory.domain.dialogue.model.UserId;
import com.study.webflux.memory.domain.memory.model.MemorySearchOptions;
import com.study.webflux.memory.domain.memory.model.MemorySearchResult;
import com.study.webflux.memory.domain.memory.model.PersistenceOutcome;

import reactor.core.publisher.Mono;

/**
 * 채팅 파이프라인이 사용하는 기억 계층의 진입점입니다.
 */
public interface HybridMemoryUseCase {

	/**
	 * 질의에 맞는 기억 문맥을 조회합니다. chatId와 turnIndex는 없을 수 있습니다.
	 */
	Mono<MemorySearchResult> search(UserId userId,
		String query,
		ChatId chatId,
		Integer turnIndex,
		MemorySearchOptions options);

	/**
	 * 완료된 대화 턴을 기록합니다. 후속 작업은 백그라운드에서 진행되며 호출자는 기다리지 않습니다.
	 */
	ConversationTurn recordTurn(UserId userId,
		ChatId chatId,
		String userPrompt,
		String aiResponse,
		TurnAttachment attachment);

	/**
	 * 채팅 종료나 전환 시점을 알립니다. 업로드는 백그라운드에서 진행됩니다.
	 */
	void endChat(UserId userId, ChatId chatId, boolean force);

	Mono<List<PersistenceOutcome>> saveAll(UserId userId);

	Mono<Void> deleteChat(UserId userId, ChatId chatId);

	Mono<Void> deleteUserData(UserId userId);
}

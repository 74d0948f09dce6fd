package com.study.webflux.memory.domain.memory.service;

import java.util.List;
import java.util.stream.Collectors;

import com.study.webflux.memory.domain.dialogue.model.ConversationTurn;

/** LLM 입력용 대화 기록 문자열을 만듭니다. */
public final class ConversationTranscript {

	private ConversationTranscript() {
	}

	public static String render(List<ConversationTurn> turns) {
		return turns.stream()
			.map(turn -> "USER: " + turn.userPrompt() + "\nASSISTANT: " + turn.aiResponse())
			.collect(Collectors.joining("\n\n"));
	}
}

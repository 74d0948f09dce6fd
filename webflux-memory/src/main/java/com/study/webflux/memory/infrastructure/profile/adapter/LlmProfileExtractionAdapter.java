package com.study.webflux.memory.infrastructure.profile.adapter;

import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.memory.domain.dialogue.model.CompletionRequest;
import com.study.webflux.memory.domain.dialogue.model.ConversationTurn;
import com.study.webflux.memory.domain.dialogue.port.LlmPort;
import com.study.webflux.memory.domain.memory.service.ConversationTranscript;
import com.study.webflux.memory.domain.profile.model.ProfileUpdate;
import com.study.webflux.memory.domain.profile.port.ProfileExtractionPort;
import com.study.webflux.memory.infrastructure.common.template.FileBasedPromptTemplate;
import reactor.core.publisher.Mono;

/**
 * LLM에 대화 전체를 보내 사용자 프로필 정보를 JSON으로 추출합니다.
 *
 * <p>
 * 응답이 마크다운 코드 블록으로 감싸져 있어도 처리하며, JSON으로 해석할 수 없으면 빈 결과를 반환합니다. LLM 호출 실패는 호출자에게 전파됩니다.
 */
@Slf4j
@Component
public class LlmProfileExtractionAdapter implements ProfileExtractionPort {

	private static final String TEMPLATE_NAME = "memory/profile-extraction";

	private final LlmPort llmPort;
	private final ObjectMapper objectMapper;
	private final FileBasedPromptTemplate promptTemplate;
	private final ProfileExtractionConfig config;

	public LlmProfileExtractionAdapter(LlmPort llmPort,
		ObjectMapper objectMapper,
		FileBasedPromptTemplate promptTemplate,
		ProfileExtractionConfig config) {
		this.llmPort = llmPort;
		this.objectMapper = objectMapper;
		this.promptTemplate = promptTemplate;
		this.config = config;
	}

	@Override
	public Mono<ProfileUpdate> extract(List<ConversationTurn> turns) {
		if (turns == null || turns.isEmpty()) {
			return Mono.empty();
		}
		String prompt = promptTemplate.load(TEMPLATE_NAME,
			Map.of("conversation", ConversationTranscript.render(turns)));
		CompletionRequest request = CompletionRequest.of(prompt, config.model());

		return llmPort.complete(request).flatMap(this::parse);
	}

	private Mono<ProfileUpdate> parse(String response) {
		String json = stripCodeFence(response);
		if (json.isEmpty()) {
			log.warn("프로필 추출 응답이 비어 있습니다");
			return Mono.empty();
		}
		try {
			ExtractedProfileResponse extracted = objectMapper.readValue(json,
				ExtractedProfileResponse.class);
			if (extracted == null) {
				return Mono.empty();
			}
			return Mono.just(extracted.toProfileUpdate());
		} catch (JsonProcessingException e) {
			log.warn("프로필 추출 응답 파싱 실패: {}", e.getOriginalMessage());
			return Mono.empty();
		}
	}

	private String stripCodeFence(String response) {
		if (response == null) {
			return "";
		}
		String trimmed = response.trim();
		if (trimmed.startsWith("```")) {
			int firstNewline = trimmed.indexOf('\n');
			trimmed = firstNewline >= 0 ? trimmed.substring(firstNewline + 1) : "";
			if (trimmed.endsWith("```")) {
				trimmed = trimmed.substring(0, trimmed.length() - 3);
			}
		}
		int start = trimmed.indexOf('{');
		int end = trimmed.lastIndexOf('}');
		if (start < 0 || end < start) {
			return trimmed.trim();
		}
		return trimmed.substring(start, end + 1);
	}
}

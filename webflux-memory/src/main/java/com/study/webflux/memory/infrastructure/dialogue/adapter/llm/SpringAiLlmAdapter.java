package com.study.webflux.memory.infrastructure.dialogue.adapter.llm;

import java.util.List;

import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.stereotype.Component;

import com.study.webflux.memory.domain.dialogue.model.CompletionRequest;
import com.study.webflux.memory.domain.dialogue.model.Message;
import com.study.webflux.memory.domain.dialogue.port.LlmPort;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Spring AI ChatModel로 단일 응답 완성을 수행합니다. 블로킹 호출이므로 boundedElastic에서 실행합니다.
 */
@Component
public class SpringAiLlmAdapter implements LlmPort {

	private final ChatModel chatModel;

	public SpringAiLlmAdapter(ChatModel chatModel) {
		this.chatModel = chatModel;
	}

	@Override
	public Mono<String> complete(CompletionRequest request) {
		return Mono.fromCallable(() -> {
			ChatResponse response = chatModel.call(toPrompt(request));
			var result = response == null ? null : response.getResult();
			if (result == null || result.getOutput() == null) {
				throw new IllegalStateException("Invalid response from LLM");
			}
			String text = result.getOutput().getText();
			return text == null ? "" : text;
		}).subscribeOn(Schedulers.boundedElastic());
	}

	private Prompt toPrompt(CompletionRequest request) {
		List<org.springframework.ai.chat.messages.Message> messages = request.messages()
			.stream()
			.map(this::convertMessage)
			.toList();
		if (request.model() == null || request.model().isBlank()) {
			return new Prompt(messages);
		}
		OpenAiChatOptions options = OpenAiChatOptions.builder().model(request.model()).build();
		return new Prompt(messages, options);
	}

	private org.springframework.ai.chat.messages.Message convertMessage(Message message) {
		return switch (message.role()) {
			case SYSTEM -> new SystemMessage(message.content());
			case USER -> new UserMessage(message.content());
			case ASSISTANT -> new AssistantMessage(message.content());
		};
	}
}

package com.study.webflux.memory.application.memory.service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import com.study.webflux.memory.application.session.service.SessionStoreService;
import com.study.webflux.memory.domain.dialogue.model.ChatId;
import com.study.webflux.memory.domain.dialogue.model.CompletionRequest;
import com.study.webflux.memory.domain.dialogue.model.ConversationTurn;
import com.study.webflux.memory.domain.dialogue.model.UserId;
import com.study.webflux.memory.domain.dialogue.port.LlmPort;
import com.study.webflux.memory.domain.memory.model.LongTermMemoryRecord;
import com.study.webflux.memory.domain.memory.model.PersistenceOutcome;
import com.study.webflux.memory.domain.memory.port.EmbeddingPort;
import com.study.webflux.memory.domain.memory.port.VectorMemoryPort;
import com.study.webflux.memory.domain.memory.service.ConversationTranscript;
import com.study.webflux.memory.domain.session.model.ChatSession;
import com.study.webflux.memory.domain.session.model.ChatSessionKey;
import com.study.webflux.memory.domain.session.model.ConversationSummary;
import com.study.webflux.memory.domain.session.model.UploadClaim;
import com.study.webflux.memory.infrastructure.common.template.FileBasedPromptTemplate;
import com.study.webflux.memory.infrastructure.memory.config.properties.MemoryProperties;
import com.study.webflux.memory.infrastructure.monitoring.config.MemoryMetricsConfiguration;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 채팅 경계에서 세션 턴을 장기 기억 저장소로 업로드합니다.
 *
 * <p>
 * 각 턴은 사용자/어시스턴트 메시지 레코드 두 개로 저장되고, 레코드 id가 결정적이므로 재업로드는 덮어쓰기가 됩니다. 이미 업로드된 턴은 다시 보내지
 * 않으며, 업로드 실패 시 세션은 미영속 상태로 남고 쿨다운이 원복됩니다.
 */
@Slf4j
@Service
public class ChatPersistenceService {

	private static final String SUMMARY_TEMPLATE = "memory/conversation-summary";

	private final SessionStoreService sessionStore;
	private final EmbeddingPort embeddingPort;
	private final VectorMemoryPort vectorMemoryPort;
	private final LlmPort llmPort;
	private final FileBasedPromptTemplate promptTemplate;
	private final MemoryMetricsConfiguration metrics;
	private final Clock clock;

	private final Duration cooldown;
	private final int maxBatchSize;
	private final boolean summaryEnabled;
	private final String summaryModel;
	private final Duration embeddingTimeout;
	private final Duration vectorStoreTimeout;
	private final Duration summaryTimeout;

	public ChatPersistenceService(SessionStoreService sessionStore,
		EmbeddingPort embeddingPort,
		VectorMemoryPort vectorMemoryPort,
		LlmPort llmPort,
		FileBasedPromptTemplate promptTemplate,
		MemoryMetricsConfiguration metrics,
		Clock clock,
		MemoryProperties properties) {
		MemoryProperties.Persistence persistence = properties.getPersistence();
		if (persistence.getMaxBatchSize() < 1) {
			throw new IllegalArgumentException("maxBatchSize must be positive");
		}
		this.sessionStore = sessionStore;
		this.embeddingPort = embeddingPort;
		this.vectorMemoryPort = vectorMemoryPort;
		this.llmPort = llmPort;
		this.promptTemplate = promptTemplate;
		this.metrics = metrics;
		this.clock = clock;
		this.cooldown = persistence.getCooldown();
		this.maxBatchSize = persistence.getMaxBatchSize();
		this.summaryEnabled = persistence.isSummaryEnabled();
		this.summaryModel = persistence.getSummaryModel();
		this.embeddingTimeout = properties.getTimeouts().getEmbedding();
		this.vectorStoreTimeout = properties.getTimeouts().getVectorStore();
		this.summaryTimeout = properties.getTimeouts().getExtraction();
	}

	/**
	 * 채팅 하나의 미업로드 턴을 저장합니다. force는 쿨다운만 무시하며 이미 업로드된 턴은 다시 보내지 않습니다.
	 */
	public Mono<PersistenceOutcome> persist(UserId userId, ChatId chatId, boolean force) {
		ChatSessionKey key = ChatSessionKey.of(userId, chatId);
		return Mono.defer(() -> {
			Optional<ChatSession> current = sessionStore.find(userId, chatId);
			if (current.isEmpty()) {
				return Mono.just(PersistenceOutcome.of(key, PersistenceOutcome.Status.NO_SESSION));
			}
			if (current.get().turns().isEmpty()) {
				return Mono.just(PersistenceOutcome.of(key, PersistenceOutcome.Status.EMPTY));
			}
			Optional<UploadClaim> claim = sessionStore.beginUpload(key, force, cooldown);
			if (claim.isEmpty()) {
				log.debug("업로드 쿨다운 중: key={}", key.asString());
				return Mono.just(PersistenceOutcome.of(key, PersistenceOutcome.Status.COOLDOWN));
			}
			return upload(claim.get());
		}).doOnNext(metrics::recordPersistenceOutcome);
	}

	/**
	 * 사용자의 모든 채팅을 쿨다운 없이 순차적으로 저장합니다.
	 */
	public Mono<List<PersistenceOutcome>> persistAll(UserId userId) {
		return Flux.fromIterable(sessionStore.findByUser(userId))
			.concatMap(session -> persist(session.userId(), session.chatId(), true))
			.collectList();
	}

	private Mono<PersistenceOutcome> upload(UploadClaim claim) {
		ChatSession snapshot = claim.session();
		ChatSessionKey key = snapshot.key();
		List<ConversationTurn> pending = snapshot.pendingTurns();
		if (pending.isEmpty()) {
			return Mono.just(PersistenceOutcome.of(key, PersistenceOutcome.Status.UP_TO_DATE));
		}

		List<String> turnIds = pending.stream().map(ConversationTurn::turnId).toList();
		List<LongTermMemoryRecord> messageRecords = toMessageRecords(snapshot, pending);

		return summarize(snapshot)
			.flatMap(summary -> {
				List<LongTermMemoryRecord> records = new ArrayList<>(messageRecords);
				summary.map(LongTermMemoryRecord::summary).ifPresent(records::add);
				return embed(records)
					.flatMap(this::upsertInBatches)
					.map(count -> {
						sessionStore.completeUpload(key, turnIds, summary.orElse(null));
						log.info("채팅 장기 기억 저장 완료: key={}, turns={}, records={}",
							key.asString(), turnIds.size(), count);
						return PersistenceOutcome.persisted(key, count);
					});
			})
			.onErrorResume(error -> {
				sessionStore.abortUpload(key, claim.previousUploadAt());
				log.error("채팅 장기 기억 저장 실패: key={}, error={}", key.asString(),
					error.getMessage(), error);
				return Mono.just(PersistenceOutcome.of(key, PersistenceOutcome.Status.FAILED));
			});
	}

	private List<LongTermMemoryRecord> toMessageRecords(ChatSession session,
		List<ConversationTurn> turns) {
		String firstTurnId = session.turns().get(0).turnId();
		List<LongTermMemoryRecord> records = new ArrayList<>(turns.size() * 2);
		for (ConversationTurn turn : turns) {
			records.add(LongTermMemoryRecord.userMessage(turn, turn.turnId().equals(firstTurnId)));
			if (!turn.aiResponse().isBlank()) {
				records.add(LongTermMemoryRecord.assistantMessage(turn));
			}
		}
		return records;
	}

	private Mono<List<LongTermMemoryRecord>> embed(List<LongTermMemoryRecord> records) {
		List<String> texts = records.stream().map(LongTermMemoryRecord::content).toList();
		return embeddingPort.embedAll(texts)
			.timeout(embeddingTimeout)
			.map(embeddings -> {
				if (embeddings.size() != records.size()) {
					throw new IllegalStateException("Embedding count mismatch: expected="
						+ records.size() + ", actual=" + embeddings.size());
				}
				List<LongTermMemoryRecord> embedded = new ArrayList<>(records.size());
				for (int i = 0; i < records.size(); i++) {
					embedded.add(records.get(i).withEmbedding(embeddings.get(i).vector()));
				}
				return embedded;
			});
	}

	private Mono<Integer> upsertInBatches(List<LongTermMemoryRecord> records) {
		return Flux.fromIterable(records)
			.buffer(maxBatchSize)
			.concatMap(batch -> vectorMemoryPort.upsertAll(batch).timeout(vectorStoreTimeout))
			.reduce(0, Integer::sum);
	}

	private Mono<Optional<ConversationSummary>> summarize(ChatSession session) {
		if (!summaryEnabled) {
			return Mono.just(Optional.empty());
		}
		String prompt = promptTemplate.load(SUMMARY_TEMPLATE,
			Map.of("conversation", ConversationTranscript.render(session.turns())));
		return llmPort.complete(CompletionRequest.of(prompt, summaryModel))
			.timeout(summaryTimeout)
			.filter(text -> !text.isBlank())
			.map(text -> Optional.of(ConversationSummary.of(session.key(), text, session.turnCount(),
				clock.instant())))
			.defaultIfEmpty(Optional.empty())
			.onErrorResume(error -> {
				log.warn("채팅 요약 생성 실패, 요약 없이 저장: key={}, error={}", session.key().asString(),
					error.getMessage());
				return Mono.just(Optional.empty());
			});
	}
}

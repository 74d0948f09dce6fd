package com.study.webflux.memory.infrastructure.memory.adapter.vectordb;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.memory.domain.dialogue.model.ChatId;
import com.study.webflux.memory.domain.dialogue.model.TurnAttachment;
import com.study.webflux.memory.domain.dialogue.model.UserId;
import com.study.webflux.memory.domain.memory.model.LongTermMemoryRecord;
import com.study.webflux.memory.domain.memory.model.MemoryMatch;
import com.study.webflux.memory.domain.memory.model.MemoryRecordMetadata;
import com.study.webflux.memory.domain.memory.model.MemoryRecordRole;
import com.study.webflux.memory.domain.memory.model.MemorySearchFilter;
import com.study.webflux.memory.domain.memory.port.VectorMemoryPort;
import com.study.webflux.memory.infrastructure.memory.adapter.vectordb.dto.QdrantDeleteRequest;
import com.study.webflux.memory.infrastructure.memory.adapter.vectordb.dto.QdrantFilter;
import com.study.webflux.memory.infrastructure.memory.adapter.vectordb.dto.QdrantOperationResponse;
import com.study.webflux.memory.infrastructure.memory.adapter.vectordb.dto.QdrantPoint;
import com.study.webflux.memory.infrastructure.memory.adapter.vectordb.dto.QdrantScoredPoint;
import com.study.webflux.memory.infrastructure.memory.adapter.vectordb.dto.QdrantSearchRequest;
import com.study.webflux.memory.infrastructure.memory.adapter.vectordb.dto.QdrantSearchResponse;
import com.study.webflux.memory.infrastructure.memory.adapter.vectordb.dto.QdrantUpsertRequest;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Qdrant REST API 기반 장기 기억 저장소 어댑터입니다.
 *
 * <p>
 * Qdrant 포인트 id는 UUID만 허용하므로 레코드 id에서 이름 기반 UUID를 만들고, 원래 레코드 id는 payload의 recordId에 보관합니다.
 */
@Slf4j
@Component
public class QdrantVectorMemoryAdapter implements VectorMemoryPort {

	static final String USER_ID = "userId";
	static final String CHAT_ID = "chatId";
	static final String RECORD_ID = "recordId";
	static final String CONTENT = "content";
	static final String ROLE = "role";
	static final String TIMESTAMP = "timestamp";
	static final String TURN_ID = "turnId";
	static final String TAGS = "tags";
	static final String FIRST_MESSAGE = "isFirstMessage";
	static final String HAS_ATTACHMENT = "hasAttachment";
	static final String ATTACHMENT_URL = "attachmentUrl";
	static final String ATTACHMENT_PROMPT = "attachmentPrompt";
	static final String TURN_COUNT = "turnCount";

	private final WebClient webClient;
	private final String collectionName;

	public QdrantVectorMemoryAdapter(WebClient.Builder webClientBuilder, QdrantConfig config) {
		WebClient.Builder builder = webClientBuilder
			.baseUrl(config.url())
			.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);

		if (config.hasApiKey()) {
			builder.defaultHeader("api-key", config.apiKey());
		}

		this.webClient = builder.build();
		this.collectionName = config.collectionName();
	}

	@Override
	public Mono<Integer> upsertAll(List<LongTermMemoryRecord> records) {
		if (records == null || records.isEmpty()) {
			return Mono.just(0);
		}
		List<QdrantPoint> points = new ArrayList<>(records.size());
		for (LongTermMemoryRecord record : records) {
			if (!record.hasEmbedding()) {
				return Mono.error(new IllegalArgumentException(
					"record has no embedding: " + record.id()));
			}
			points.add(new QdrantPoint(pointId(record.id()), record.embedding(), toPayload(record)));
		}

		return webClient.put()
			.uri(uriBuilder -> uriBuilder.path("/collections/{collection}/points")
				.queryParam("wait", true)
				.build(collectionName))
			.bodyValue(new QdrantUpsertRequest(points))
			.retrieve()
			.onStatus(HttpStatusCode::isError, response -> failure("upsert", response))
			.bodyToMono(QdrantOperationResponse.class)
			.thenReturn(points.size())
			.doOnNext(count -> log.debug("Qdrant upsert 완료: collection={}, points={}",
				collectionName, count));
	}

	@Override
	public Flux<MemoryMatch> search(List<Float> queryEmbedding,
		MemorySearchFilter filter,
		int topK,
		float scoreThreshold) {
		if (topK <= 0) {
			return Flux.empty();
		}
		QdrantSearchRequest request = new QdrantSearchRequest(queryEmbedding, topK, true,
			toQdrantFilter(filter), scoreThreshold);

		return webClient.post()
			.uri("/collections/{collection}/points/search", collectionName)
			.bodyValue(request)
			.retrieve()
			.onStatus(HttpStatusCode::isError, response -> failure("search", response))
			.bodyToMono(QdrantSearchResponse.class)
			.flatMapMany(response -> response.result() == null
				? Flux.empty()
				: Flux.fromIterable(response.result()))
			.mapNotNull(this::toMatch);
	}

	@Override
	public Mono<Void> delete(MemorySearchFilter filter) {
		return webClient.post()
			.uri(uriBuilder -> uriBuilder.path("/collections/{collection}/points/delete")
				.queryParam("wait", true)
				.build(collectionName))
			.bodyValue(new QdrantDeleteRequest(toQdrantFilter(filter)))
			.retrieve()
			.onStatus(HttpStatusCode::isError, response -> failure("delete", response))
			.bodyToMono(QdrantOperationResponse.class)
			.doOnNext(response -> log.info("Qdrant 삭제 완료: collection={}, userId={}, chatId={}",
				collectionName, filter.userId().value(),
				filter.isChatScoped() ? filter.chatId().value() : "*"))
			.then();
	}

	static String pointId(String recordId) {
		return UUID.nameUUIDFromBytes(recordId.getBytes(StandardCharsets.UTF_8)).toString();
	}

	static QdrantFilter toQdrantFilter(MemorySearchFilter filter) {
		List<QdrantFilter.FilterCondition> conditions = new ArrayList<>();
		conditions.add(QdrantFilter.FilterCondition.matchValue(USER_ID, filter.userId().value()));
		if (filter.isChatScoped()) {
			conditions.add(QdrantFilter.FilterCondition.matchValue(CHAT_ID, filter.chatId().value()));
		}
		return new QdrantFilter(conditions);
	}

	private Map<String, Object> toPayload(LongTermMemoryRecord record) {
		MemoryRecordMetadata metadata = record.metadata();
		Map<String, Object> payload = new HashMap<>();
		payload.put(RECORD_ID, record.id());
		payload.put(CONTENT, record.content());
		payload.put(USER_ID, metadata.userId().value());
		payload.put(CHAT_ID, metadata.chatId().value());
		payload.put(ROLE, metadata.role().value());
		payload.put(TIMESTAMP, metadata.timestamp().toEpochMilli());
		payload.put(TAGS, metadata.tags());
		payload.put(FIRST_MESSAGE, metadata.firstMessage());
		payload.put(HAS_ATTACHMENT, metadata.hasAttachment());

		if (metadata.turnId() != null) {
			payload.put(TURN_ID, metadata.turnId());
		}
		if (metadata.hasAttachment()) {
			payload.put(ATTACHMENT_URL, metadata.attachment().url());
			if (metadata.attachment().prompt() != null) {
				payload.put(ATTACHMENT_PROMPT, metadata.attachment().prompt());
			}
		}
		if (metadata.turnCount() != null) {
			payload.put(TURN_COUNT, metadata.turnCount());
		}
		return payload;
	}

	private MemoryMatch toMatch(QdrantScoredPoint point) {
		Map<String, Object> payload = point.payload();
		if (payload == null
			|| !(payload.get(USER_ID) instanceof String userId)
			|| !(payload.get(CHAT_ID) instanceof String chatId)
			|| !(payload.get(CONTENT) instanceof String content)
			|| !(payload.get(ROLE) instanceof String role)) {
			log.warn("잘못된 Qdrant 페이로드를 건너뜁니다: pointId={}", point.id());
			return null;
		}

		String recordId = payload.get(RECORD_ID) instanceof String value ? value : point.id();
		Instant timestamp = payload.get(TIMESTAMP) instanceof Number millis
			? Instant.ofEpochMilli(millis.longValue())
			: Instant.EPOCH;
		String turnId = payload.get(TURN_ID) instanceof String value ? value : null;
		List<String> tags = payload.get(TAGS) instanceof List<?> values
			? values.stream().map(String::valueOf).toList()
			: List.of();
		boolean firstMessage = Boolean.TRUE.equals(payload.get(FIRST_MESSAGE));
		TurnAttachment attachment = payload.get(ATTACHMENT_URL) instanceof String url
			? TurnAttachment.of(url, payload.get(ATTACHMENT_PROMPT) instanceof String prompt
				? prompt
				: null)
			: null;
		Integer turnCount = payload.get(TURN_COUNT) instanceof Number count ? count.intValue() : null;

		try {
			MemoryRecordMetadata metadata = new MemoryRecordMetadata(UserId.of(userId),
				ChatId.of(chatId), MemoryRecordRole.fromValue(role), timestamp, turnId, tags,
				attachment, firstMessage, turnCount);
			return new MemoryMatch(new LongTermMemoryRecord(recordId, content, null, metadata),
				point.score());
		} catch (IllegalArgumentException e) {
			log.warn("해석할 수 없는 Qdrant 포인트를 건너뜁니다: pointId={}, reason={}", point.id(),
				e.getMessage());
			return null;
		}
	}

	private Mono<? extends Throwable> failure(String operation, ClientResponse response) {
		int status = response.statusCode().value();
		return response.bodyToMono(String.class)
			.defaultIfEmpty("")
			.map(body -> new IllegalStateException(
				"Qdrant " + operation + " 실패 status=" + status + " body=" + body));
	}
}

package com.study.webflux.memory.infrastructure.memory.config;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.memory.infrastructure.memory.adapter.vectordb.QdrantConfig;
import reactor.core.publisher.Mono;

/**
 * Qdrant 컬렉션과 userId/chatId 필터용 keyword 인덱스를 준비합니다.
 *
 * <p>
 * 초기화 실패는 기동을 막지 않습니다. 장기 기억 조회는 실패 시 로컬 결과로 대체됩니다.
 */
@Slf4j
@Component
public class QdrantCollectionInitializer implements ApplicationRunner {

	private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
	private static final List<String> KEYWORD_INDEX_FIELDS = List.of("userId", "chatId");

	private final QdrantConfig config;
	private final WebClient webClient;

	public QdrantCollectionInitializer(QdrantConfig config, WebClient.Builder webClientBuilder) {
		this.config = config;
		WebClient.Builder builder = webClientBuilder.baseUrl(config.url());
		if (config.hasApiKey()) {
			builder.defaultHeader("api-key", config.apiKey());
		}
		this.webClient = builder.build();
	}

	@Override
	public void run(ApplicationArguments args) {
		initialize();
	}

	/**
	 * 컬렉션이 없으면 만들고 인덱스를 보장합니다. 준비에 성공하면 true를 반환합니다.
	 */
	public boolean initialize() {
		if (!config.autoCreateCollection()) {
			log.info("Qdrant 컬렉션 자동 생성이 비활성화되어 초기화를 건너뜁니다. collection={}",
				config.collectionName());
			return false;
		}
		try {
			if (collectionExists()) {
				log.info("Qdrant 컬렉션이 이미 존재합니다. collection={}", config.collectionName());
			} else {
				createCollection();
			}
			KEYWORD_INDEX_FIELDS.forEach(this::createKeywordIndex);
			return true;
		} catch (RuntimeException e) {
			log.error("Qdrant 컬렉션 초기화 실패, 장기 기억 기능이 제한됩니다. collection={}, error={}",
				config.collectionName(), e.getMessage(), e);
			return false;
		}
	}

	private boolean collectionExists() {
		return webClient.get()
			.uri("/collections/{collectionName}", config.collectionName())
			.exchangeToMono(response -> {
				HttpStatusCode status = response.statusCode();
				if (status.is2xxSuccessful()) {
					return Mono.just(true);
				}
				if (status.value() == 404) {
					return Mono.just(false);
				}
				return response.bodyToMono(String.class)
					.defaultIfEmpty("")
					.flatMap(body -> Mono.<Boolean>error(new IllegalStateException(
						"Qdrant 컬렉션 조회 실패 status=" + status.value() + " body=" + body)));
			})
			.blockOptional(REQUEST_TIMEOUT)
			.orElse(false);
	}

	private void createCollection() {
		Map<String, Object> payload = Map.of("vectors",
			Map.of("size", config.vectorDimension(), "distance", "Cosine"));

		send(webClient.put()
			.uri("/collections/{collectionName}", config.collectionName())
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(payload), "컬렉션 생성");

		log.info("Qdrant 컬렉션을 준비했습니다. collection={}, vectorDimension={}",
			config.collectionName(), config.vectorDimension());
	}

	private void createKeywordIndex(String fieldName) {
		Map<String, Object> payload = Map.of("field_name", fieldName, "field_schema", "keyword");

		send(webClient.put()
			.uri("/collections/{collectionName}/index", config.collectionName())
			.contentType(MediaType.APPLICATION_JSON)
			.bodyValue(payload), "인덱스 생성(" + fieldName + ")");

		log.debug("Qdrant payload 인덱스 확인: collection={}, field={}", config.collectionName(),
			fieldName);
	}

	private void send(WebClient.RequestHeadersSpec<?> request, String operation) {
		request.<Void>exchangeToMono(response -> {
			HttpStatusCode status = response.statusCode();
			if (status.is2xxSuccessful() || status.value() == 409) {
				return response.releaseBody();
			}
			return response.bodyToMono(String.class)
				.defaultIfEmpty("")
				.flatMap(body -> Mono.<Void>error(new IllegalStateException(
					"Qdrant " + operation + " 실패 status=" + status.value() + " body=" + body)));
		}).block(REQUEST_TIMEOUT);
	}
}

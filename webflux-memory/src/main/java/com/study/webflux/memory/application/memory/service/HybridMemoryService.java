package com.study.webflux.memory.application.memory.service;

import java.time.Duration;
import java.util.List;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import com.study.webflux.memory.application.memory.support.MemoryTaskExecutor;
import com.study.webflux.memory.application.profile.service.ProfileExtractionService;
import com.study.webflux.memory.application.profile.service.UserProfileService;
import com.study.webflux.memory.application.session.service.SessionStoreService;
import com.study.webflux.memory.domain.dialogue.model.ChatId;
import com.study.webflux.memory.domain.dialogue.model.ConversationTurn;
import com.study.webflux.memory.domain.dialogue.model.TurnAttachment;
import com.study.webflux.memory.domain.dialogue.model.UserId;
import com.study.webflux.memory.domain.memory.model.MemoryMatch;
import com.study.webflux.memory.domain.memory.model.MemorySearchFilter;
import com.study.webflux.memory.domain.memory.model.MemorySearchOptions;
import com.study.webflux.memory.domain.memory.model.MemorySearchResult;
import com.study.webflux.memory.domain.memory.model.PersistenceOutcome;
import com.study.webflux.memory.domain.memory.model.StrategyDecision;
import com.study.webflux.memory.domain.memory.port.EmbeddingPort;
import com.study.webflux.memory.domain.memory.port.HybridMemoryUseCase;
import com.study.webflux.memory.domain.memory.port.RecentContextCachePort;
import com.study.webflux.memory.domain.memory.port.VectorMemoryPort;
import com.study.webflux.memory.domain.memory.service.LocalRelevanceRanker;
import com.study.webflux.memory.domain.memory.service.MemoryContextFormatter;
import com.study.webflux.memory.domain.memory.service.RetrievalStrategySelector;
import com.study.webflux.memory.domain.session.model.ChatSession;
import com.study.webflux.memory.domain.session.model.ChatSessionKey;
import com.study.webflux.memory.domain.session.model.ConversationSummary;
import com.study.webflux.memory.infrastructure.memory.config.properties.MemoryProperties;
import com.study.webflux.memory.infrastructure.monitoring.config.MemoryMetricsConfiguration;

import reactor.core.publisher.Mono;

/**
 * 세션 저장소, 사용자 프로필, 장기 기억 저장소를 묶어 질의별 기억 문맥을 만드는 오케스트레이터입니다.
 *
 * <p>
 * 조회 전략은 질의마다 결정되며, skip과 profile-only는 세션과 벡터 저장소에 접근하지 않습니다. full 전략에서 로컬 결과가 충분하면 임베딩과 벡터
 * 검색을 생략합니다. 쓰기 경로는 모두 {@link MemoryTaskExecutor}로 넘겨 호출자를 기다리게 하지 않습니다.
 */
@Slf4j
@Service
public class HybridMemoryService implements HybridMemoryUseCase {

	private static final int LOG_QUERY_LENGTH = 50;

	private final SessionStoreService sessionStore;
	private final UserProfileService profileService;
	private final ProfileExtractionService profileExtractionService;
	private final ChatPersistenceService persistenceService;
	private final EmbeddingPort embeddingPort;
	private final VectorMemoryPort vectorMemoryPort;
	private final RecentContextCachePort recentContextCache;
	private final RetrievalStrategySelector strategySelector;
	private final MemoryContextFormatter formatter;
	private final MemoryTaskExecutor taskExecutor;
	private final MemoryMetricsConfiguration metrics;
	private final MemorySearchOptions defaultOptions;

	private final Duration embeddingTimeout;
	private final Duration vectorStoreTimeout;
	private final Duration cacheTtl;
	private final int cacheTurns;

	public HybridMemoryService(SessionStoreService sessionStore,
		UserProfileService profileService,
		ProfileExtractionService profileExtractionService,
		ChatPersistenceService persistenceService,
		EmbeddingPort embeddingPort,
		VectorMemoryPort vectorMemoryPort,
		RecentContextCachePort recentContextCache,
		RetrievalStrategySelector strategySelector,
		MemoryContextFormatter formatter,
		MemoryTaskExecutor taskExecutor,
		MemoryMetricsConfiguration metrics,
		MemorySearchOptions defaultOptions,
		MemoryProperties properties) {
		this.sessionStore = sessionStore;
		this.profileService = profileService;
		this.profileExtractionService = profileExtractionService;
		this.persistenceService = persistenceService;
		this.embeddingPort = embeddingPort;
		this.vectorMemoryPort = vectorMemoryPort;
		this.recentContextCache = recentContextCache;
		this.strategySelector = strategySelector;
		this.formatter = formatter;
		this.taskExecutor = taskExecutor;
		this.metrics = metrics;
		this.defaultOptions = defaultOptions;
		this.embeddingTimeout = properties.getTimeouts().getEmbedding();
		this.vectorStoreTimeout = properties.getTimeouts().getVectorStore();
		this.cacheTtl = properties.getCache().getTtl();
		this.cacheTurns = properties.getCache().getTurns();
	}

	@Override
	public Mono<MemorySearchResult> search(UserId userId,
		String query,
		ChatId chatId,
		Integer turnIndex,
		MemorySearchOptions options) {
		requireUserId(userId);
		MemorySearchOptions effective = options != null ? options : defaultOptions;
		StrategyDecision decision = effective.hasStrategyOverride()
			? StrategyDecision.forced(effective.strategyOverride())
			: strategySelector.decide(query, turnIndex);

		metrics.recordStrategy(decision.strategy());
		log.debug("기억 조회 전략: userId={}, strategy={}, reason={}, query={}", userId.value(),
			decision.strategy().value(), decision.reason(), abbreviate(query));

		Mono<MemorySearchResult> result = switch (decision.strategy()) {
			case SKIP -> Mono.just(MemorySearchResult.skipped(decision));
			case PROFILE_ONLY -> Mono.fromSupplier(() -> profileOnly(userId, decision));
			case CACHED -> cached(userId, chatId, decision);
			case FULL -> full(userId, query, chatId, turnIndex, effective, decision);
		};
		return result.doOnNext(searchResult -> metrics.recordRetrievedItems(
			searchResult.counts().total()));
	}

	@Override
	public ConversationTurn recordTurn(UserId userId,
		ChatId chatId,
		String userPrompt,
		String aiResponse,
		TurnAttachment attachment) {
		ConversationTurn turn = sessionStore.newTurn(userId, chatId, userPrompt, aiResponse,
			attachment);
		taskExecutor.submit("record-turn", () -> appendTurn(turn));
		return turn;
	}

	@Override
	public void endChat(UserId userId, ChatId chatId, boolean force) {
		requireUserId(userId);
		requireChatId(chatId);
		taskExecutor.submit("chat-persistence",
			() -> persistenceService.persist(userId, chatId, force));
	}

	@Override
	public Mono<List<PersistenceOutcome>> saveAll(UserId userId) {
		requireUserId(userId);
		return persistenceService.persistAll(userId);
	}

	/**
	 * 채팅 하나의 세션, 캐시, 장기 기억을 삭제합니다. 장기 기억 삭제 실패는 호출자에게 전파됩니다.
	 */
	@Override
	public Mono<Void> deleteChat(UserId userId, ChatId chatId) {
		requireUserId(userId);
		requireChatId(chatId);
		ChatSessionKey key = ChatSessionKey.of(userId, chatId);
		return Mono.fromRunnable(() -> sessionStore.remove(key))
			.then(Mono.defer(() -> recentContextCache.evict(userId, chatId)).onErrorResume(error -> {
				log.warn("최근 대화 캐시 삭제 실패: key={}, error={}", key.asString(), error.getMessage());
				return Mono.empty();
			}))
			.then(Mono.defer(() -> vectorMemoryPort.delete(MemorySearchFilter.forChat(userId, chatId)))
				.timeout(vectorStoreTimeout))
			.doOnSuccess(ignored -> log.info("채팅 기억 삭제 완료: key={}", key.asString()));
	}

	/**
	 * 사용자의 세션, 프로필, 캐시, 장기 기억을 모두 삭제합니다.
	 */
	@Override
	public Mono<Void> deleteUserData(UserId userId) {
		requireUserId(userId);
		return Mono.fromRunnable(() -> {
			int sessions = sessionStore.removeUser(userId);
			profileService.delete(userId);
			log.info("사용자 로컬 기억 삭제: userId={}, sessions={}", userId.value(), sessions);
		})
			.then(Mono.defer(() -> recentContextCache.evictUser(userId)).onErrorResume(error -> {
				log.warn("사용자 캐시 삭제 실패: userId={}, error={}", userId.value(), error.getMessage());
				return Mono.empty();
			}))
			.then(Mono.defer(() -> vectorMemoryPort.delete(MemorySearchFilter.forUser(userId)))
				.timeout(vectorStoreTimeout))
			.doOnSuccess(ignored -> log.info("사용자 기억 전체 삭제 완료: userId={}", userId.value()));
	}

	Mono<ChatSession> appendTurn(ConversationTurn turn) {
		return Mono.fromCallable(() -> sessionStore.append(turn))
			.doOnNext(profileExtractionService::onTurnAppended)
			.flatMap(session -> refreshRecentContext(session).thenReturn(session));
	}

	private Mono<Void> refreshRecentContext(ChatSession session) {
		String rendered = formatter.renderRecentTurns(session.recentTurns(cacheTurns));
		return recentContextCache.put(session.userId(), session.chatId(), rendered, cacheTtl)
			.onErrorResume(error -> {
				log.warn("최근 대화 캐시 갱신 실패: key={}, error={}", session.key().asString(),
					error.getMessage());
				return Mono.empty();
			});
	}

	private MemorySearchResult profileOnly(UserId userId, StrategyDecision decision) {
		return MemorySearchResult.profileOnly(profileService.generateContext(userId), decision);
	}

	private Mono<MemorySearchResult> cached(UserId userId, ChatId chatId, StrategyDecision decision) {
		if (chatId == null) {
			return Mono.fromSupplier(() -> profileOnly(userId, decision));
		}
		return recentContextCache.get(userId, chatId)
			.filter(context -> !context.isBlank())
			.map(context -> new MemorySearchResult(context, MemorySearchResult.ResultCounts.none(),
				false, false, decision.strategy(), decision.reason()))
			.onErrorResume(error -> {
				log.warn("최근 대화 캐시 조회 실패: userId={}, error={}", userId.value(),
					error.getMessage());
				return Mono.empty();
			})
			.switchIfEmpty(Mono.fromSupplier(() -> profileOnly(userId, decision)));
	}

	private Mono<MemorySearchResult> full(UserId userId,
		String query,
		ChatId chatId,
		Integer turnIndex,
		MemorySearchOptions options,
		StrategyDecision decision) {
		boolean newChat = chatId == null || turnIndex == null || turnIndex == 0;
		ChatId scope = newChat ? null : chatId;

		return Mono.fromSupplier(() -> {
			List<ConversationTurn> candidates = sessionStore.recent(userId, scope,
				options.localScanLimit());
			List<ConversationTurn> localTurns = LocalRelevanceRanker.rank(query, candidates,
				options.maxLocalResults());
			List<ConversationSummary> summaries = options.includeLocalSummaries()
				? sessionStore.summaries(userId, scope)
				: List.<ConversationSummary>of();
			return new LocalResults(profileService.generateContext(userId), localTurns, summaries);
		}).flatMap(local -> {
			int localCount = local.turns().size() + local.summaries().size();
			if (options.skipDurableIfLocalFound() && localCount >= options.minLocalResultsForSkip()) {
				metrics.recordDurableSearchSkipped();
				log.debug("로컬 결과로 충분하여 장기 기억 검색 생략: userId={}, local={}", userId.value(),
					localCount);
				return Mono.just(assemble(local, List.of(), true, decision));
			}
			MemorySearchFilter filter = scope == null
				? MemorySearchFilter.forUser(userId)
				: MemorySearchFilter.forChat(userId, scope);
			return searchLongTerm(query, filter, options)
				.map(matches -> assemble(local, matches, false, decision));
		});
	}

	private Mono<List<MemoryMatch>> searchLongTerm(String query,
		MemorySearchFilter filter,
		MemorySearchOptions options) {
		if (query == null || query.isBlank() || options.maxLongTermResults() == 0) {
			return Mono.just(List.of());
		}
		return embeddingPort.embed(query)
			.timeout(embeddingTimeout)
			.flatMap(embedding -> vectorMemoryPort
				.search(embedding.vector(), filter, options.maxLongTermResults(), options.threshold())
				.timeout(vectorStoreTimeout)
				.filter(filter::accepts)
				.filter(match -> match.score() >= options.threshold())
				.take(options.maxLongTermResults())
				.collectList())
			.defaultIfEmpty(List.of())
			.onErrorResume(error -> {
				metrics.recordDurableSearchFailure();
				log.warn("장기 기억 검색 실패, 로컬 결과만 사용: userId={}, error={}",
					filter.userId().value(), error.getMessage());
				return Mono.just(List.of());
			});
	}

	private MemorySearchResult assemble(LocalResults local,
		List<MemoryMatch> matches,
		boolean skippedDurableSearch,
		StrategyDecision decision) {
		String context = formatter.combine(local.profileContext(), local.turns(), local.summaries(),
			matches);
		MemorySearchResult.ResultCounts counts = new MemorySearchResult.ResultCounts(
			local.turns().size(), matches.size(), local.summaries().size());
		return new MemorySearchResult(context, counts, !local.profileContext().isBlank(),
			skippedDurableSearch, decision.strategy(), decision.reason());
	}

	private static void requireUserId(UserId userId) {
		if (userId == null) {
			throw new IllegalArgumentException("userId cannot be null");
		}
	}

	private static void requireChatId(ChatId chatId) {
		if (chatId == null) {
			throw new IllegalArgumentException("chatId cannot be null");
		}
	}

	private static String abbreviate(String query) {
		if (query == null) {
			return "";
		}
		return query.length() <= LOG_QUERY_LENGTH ? query : query.substring(0, LOG_QUERY_LENGTH) + "...";
	}

	private record LocalResults(
		String profileContext,
		List<ConversationTurn> turns,
		List<ConversationSummary> summaries
	) {
	}
}

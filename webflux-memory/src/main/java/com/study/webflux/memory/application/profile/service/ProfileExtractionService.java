package com.study.webflux.memory.application.profile.service;

import java.time.Duration;
import java.util.List;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import com.study.webflux.memory.application.memory.support.MemoryTaskExecutor;
import com.study.webflux.memory.domain.dialogue.model.ConversationTurn;
import com.study.webflux.memory.domain.dialogue.model.UserId;
import com.study.webflux.memory.domain.profile.model.UserProfile;
import com.study.webflux.memory.domain.profile.port.ProfileExtractionPort;
import com.study.webflux.memory.domain.session.model.ChatSession;
import com.study.webflux.memory.infrastructure.memory.config.properties.MemoryProperties;
import com.study.webflux.memory.infrastructure.monitoring.config.MemoryMetricsConfiguration;

import reactor.core.publisher.Mono;

/**
 * 일정 턴마다 대화 전체에서 사용자 정보를 추출해 프로필에 병합합니다.
 */
@Slf4j
@Service
public class ProfileExtractionService {

	private final ProfileExtractionPort extractionPort;
	private final UserProfileService profileService;
	private final MemoryTaskExecutor taskExecutor;
	private final MemoryMetricsConfiguration metrics;
	private final int extractionInterval;
	private final Duration extractionTimeout;

	public ProfileExtractionService(ProfileExtractionPort extractionPort,
		UserProfileService profileService,
		MemoryTaskExecutor taskExecutor,
		MemoryMetricsConfiguration metrics,
		MemoryProperties properties) {
		int interval = properties.getProfile().getExtractionInterval();
		if (interval < 1) {
			throw new IllegalArgumentException("extractionInterval must be positive");
		}
		this.extractionPort = extractionPort;
		this.profileService = profileService;
		this.taskExecutor = taskExecutor;
		this.metrics = metrics;
		this.extractionInterval = interval;
		this.extractionTimeout = properties.getTimeouts().getExtraction();
	}

	/**
	 * 턴 추가 직후 호출됩니다. 턴 수가 추출 주기의 배수이면 백그라운드 추출을 예약합니다.
	 */
	public boolean onTurnAppended(ChatSession session) {
		int turnCount = session.turnCount();
		if (turnCount == 0 || turnCount % extractionInterval != 0) {
			return false;
		}
		metrics.recordExtractionTriggered();
		log.info("프로필 추출 트리거: userId={}, chatId={}, turns={}", session.userId().value(),
			session.chatId().value(), turnCount);
		List<ConversationTurn> snapshot = session.turns();
		taskExecutor.submit("profile-extraction", () -> extractAndMerge(session.userId(), snapshot));
		return true;
	}

	/**
	 * 추출에 실패하거나 결과가 비어 있으면 기존 프로필을 그대로 둡니다.
	 */
	public Mono<UserProfile> extractAndMerge(UserId userId, List<ConversationTurn> turns) {
		return extractionPort.extract(turns)
			.timeout(extractionTimeout)
			.filter(update -> !update.isEmpty())
			.map(update -> profileService.mergeExtracted(userId, update))
			.doOnNext(profile -> {
				metrics.recordExtractionSuccess();
				log.info("프로필 갱신: userId={}, conversationCount={}", userId.value(),
					profile.conversationCount());
			})
			.doOnError(error -> {
				metrics.recordExtractionFailure();
				log.warn("프로필 추출 실패, 기존 프로필 유지: userId={}, error={}", userId.value(),
					error.getMessage());
			})
			.onErrorResume(error -> Mono.empty());
	}
}

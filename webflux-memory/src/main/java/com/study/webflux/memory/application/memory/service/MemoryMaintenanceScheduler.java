package com.study.webflux.memory.application.memory.service;

import java.time.Duration;

import lombok.extern.slf4j.Slf4j;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.study.webflux.memory.application.memory.support.MemoryTaskExecutor;
import com.study.webflux.memory.application.session.service.SessionStoreService;
import com.study.webflux.memory.domain.session.model.ChatSessionKey;
import com.study.webflux.memory.domain.session.model.SessionEviction;
import com.study.webflux.memory.infrastructure.memory.config.properties.MemoryProperties;
import com.study.webflux.memory.infrastructure.monitoring.config.MemoryMetricsConfiguration;

/**
 * 비활성 세션을 주기적으로 정리합니다. 업로드되지 않은 턴이 남은 세션은 제거 대신 업로드를 예약합니다.
 */
@Service
@Slf4j
public class MemoryMaintenanceScheduler {

	private final SessionStoreService sessionStore;
	private final ChatPersistenceService persistenceService;
	private final MemoryTaskExecutor taskExecutor;
	private final MemoryMetricsConfiguration metrics;
	private final Duration inactivityWindow;

	public MemoryMaintenanceScheduler(SessionStoreService sessionStore,
		ChatPersistenceService persistenceService,
		MemoryTaskExecutor taskExecutor,
		MemoryMetricsConfiguration metrics,
		MemoryProperties properties) {
		this.sessionStore = sessionStore;
		this.persistenceService = persistenceService;
		this.taskExecutor = taskExecutor;
		this.metrics = metrics;
		this.inactivityWindow = properties.getSession().getInactivityWindow();
	}

	@Scheduled(fixedDelayString = "${memory.session.sweep-interval:PT5M}",
		initialDelayString = "${memory.session.sweep-interval:PT5M}")
	public void sweepInactiveSessions() {
		SessionEviction eviction = sessionStore.evictStale(inactivityWindow);
		if (eviction.isEmpty()) {
			return;
		}

		metrics.recordSessionsEvicted(eviction.evicted().size());
		for (ChatSessionKey key : eviction.pendingPersistence()) {
			taskExecutor.submit("sweep-persistence",
				() -> persistenceService.persist(key.userId(), key.chatId(), false));
		}
		log.info("세션 정리 완료: evicted={}, pendingPersistence={}, overdue={}",
			eviction.evicted().size(), eviction.pendingPersistence().size(),
			eviction.overdue().size());
	}
}

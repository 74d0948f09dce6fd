package com.study.webflux.memory.infrastructure.monitoring.config;

import java.util.Locale;

import org.springframework.stereotype.Component;

import com.study.webflux.memory.domain.memory.model.PersistenceOutcome;
import com.study.webflux.memory.domain.memory.model.RetrievalStrategy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * 기억 계층의 조회 전략, 프로필 추출, 장기 기억 업로드 메트릭을 제공합니다.
 */
@Component
public class MemoryMetricsConfiguration {

	private final MeterRegistry meterRegistry;

	private final Counter durableSearchSkippedCounter;
	private final Counter durableSearchFailureCounter;
	private final Counter extractionTriggeredCounter;
	private final Counter extractionSuccessCounter;
	private final Counter extractionFailureCounter;
	private final Counter sessionEvictedCounter;

	private final DistributionSummary retrievedItemCount;
	private final DistributionSummary persistedRecordCount;

	public MemoryMetricsConfiguration(MeterRegistry meterRegistry) {
		this.meterRegistry = meterRegistry;

		this.durableSearchSkippedCounter = Counter.builder("memory.retrieval.durable.skipped")
			.description("Number of full searches answered from the session store alone")
			.register(meterRegistry);

		this.durableSearchFailureCounter = Counter.builder("memory.retrieval.durable.failure")
			.description("Number of long-term memory searches that failed or timed out")
			.register(meterRegistry);

		this.extractionTriggeredCounter = Counter.builder("memory.profile.extraction.triggered")
			.description("Number of times profile extraction was triggered")
			.register(meterRegistry);

		this.extractionSuccessCounter = Counter.builder("memory.profile.extraction.success")
			.description("Number of profile extractions merged into a profile")
			.register(meterRegistry);

		this.extractionFailureCounter = Counter.builder("memory.profile.extraction.failure")
			.description("Number of failed profile extractions")
			.register(meterRegistry);

		this.sessionEvictedCounter = Counter.builder("memory.session.evicted")
			.description("Number of sessions removed by the maintenance sweep")
			.register(meterRegistry);

		this.retrievedItemCount = DistributionSummary.builder("memory.retrieval.items")
			.description("Number of context items returned per search")
			.publishPercentiles(0.5, 0.9, 0.99)
			.register(meterRegistry);

		this.persistedRecordCount = DistributionSummary.builder("memory.persistence.records")
			.description("Number of records upserted per chat upload")
			.register(meterRegistry);
	}

	/**
	 * 선택된 조회 전략을 기록합니다.
	 */
	public void recordStrategy(RetrievalStrategy strategy) {
		Counter.builder("memory.retrieval.strategy")
			.tag("strategy", strategy.value())
			.description("Number of searches by retrieval strategy")
			.register(meterRegistry)
			.increment();
	}

	public void recordDurableSearchSkipped() {
		durableSearchSkippedCounter.increment();
	}

	public void recordDurableSearchFailure() {
		durableSearchFailureCounter.increment();
	}

	public void recordRetrievedItems(int count) {
		retrievedItemCount.record(count);
	}

	public void recordExtractionTriggered() {
		extractionTriggeredCounter.increment();
	}

	public void recordExtractionSuccess() {
		extractionSuccessCounter.increment();
	}

	public void recordExtractionFailure() {
		extractionFailureCounter.increment();
	}

	/**
	 * 채팅 업로드 결과를 상태별로 기록합니다.
	 */
	public void recordPersistenceOutcome(PersistenceOutcome outcome) {
		Counter.builder("memory.persistence.outcome")
			.tag("status", outcome.status().name().toLowerCase(Locale.ROOT))
			.description("Number of chat uploads by outcome")
			.register(meterRegistry)
			.increment();
		if (outcome.status() == PersistenceOutcome.Status.PERSISTED) {
			persistedRecordCount.record(outcome.recordCount());
		}
	}

	/**
	 * 백그라운드 작업 실패를 작업 이름별로 기록합니다.
	 */
	public void recordTaskFailure(String taskName) {
		Counter.builder("memory.task.failure")
			.tag("task", taskName)
			.description("Number of failed background memory tasks")
			.register(meterRegistry)
			.increment();
	}

	public void recordSessionsEvicted(int count) {
		sessionEvictedCounter.increment(count);
	}
}

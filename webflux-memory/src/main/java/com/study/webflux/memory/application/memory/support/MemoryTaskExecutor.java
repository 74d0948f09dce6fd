package com.study.webflux.memory.application.memory.support;

import java.time.Duration;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

import com.study.webflux.memory.infrastructure.monitoring.config.MemoryMetricsConfiguration;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

/**
 * 호출자를 기다리게 하지 않는 기억 계층 백그라운드 작업 실행기입니다.
 *
 * <p>
 * 작업은 전용 스케줄러에서 구독되고 마감 시간을 넘기면 취소됩니다. 실패는 로그와 메트릭으로만 남고 호출자에게 전파되지 않습니다.
 */
@Slf4j
public class MemoryTaskExecutor {

	private final Scheduler scheduler;
	private final Duration deadline;
	private final MemoryMetricsConfiguration metrics;

	public MemoryTaskExecutor(Scheduler scheduler,
		Duration deadline,
		MemoryMetricsConfiguration metrics) {
		if (scheduler == null) {
			throw new IllegalArgumentException("scheduler cannot be null");
		}
		if (deadline == null || deadline.isNegative() || deadline.isZero()) {
			throw new IllegalArgumentException("deadline must be positive");
		}
		this.scheduler = scheduler;
		this.deadline = deadline;
		this.metrics = metrics;
	}

	public void submit(String taskName, Supplier<? extends Mono<?>> task) {
		Mono.defer(task)
			.subscribeOn(scheduler)
			.timeout(deadline)
			.doOnError(error -> {
				metrics.recordTaskFailure(taskName);
				log.error("백그라운드 작업 실패: task={}, error={}", taskName, error.getMessage(), error);
			})
			.onErrorResume(error -> Mono.empty())
			.subscribe();
	}
}

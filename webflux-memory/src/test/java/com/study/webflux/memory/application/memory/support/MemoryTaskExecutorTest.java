package com.study.webflux.memory.application.memory.support;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import com.study.webflux.memory.infrastructure.monitoring.config.MemoryMetricsConfiguration;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MemoryTaskExecutorTest {

	private SimpleMeterRegistry meterRegistry;
	private MemoryTaskExecutor executor;

	@BeforeEach
	void setUp() {
		meterRegistry = new SimpleMeterRegistry();
		executor = new MemoryTaskExecutor(Schedulers.immediate(), Duration.ofSeconds(1),
			new MemoryMetricsConfiguration(meterRegistry));
	}

	@Test
	@DisplayName("작업을 실행")
	void submit_runsTask() {
		AtomicBoolean ran = new AtomicBoolean();

		executor.submit("test", () -> Mono.fromRunnable(() -> ran.set(true)));

		assertThat(ran).isTrue();
	}

	@Test
	@DisplayName("작업 실패는 호출자에게 전파되지 않고 메트릭으로 기록")
	void submit_failure_isRecorded() {
		assertThatCode(() -> executor.submit("broken",
			() -> Mono.error(new IllegalStateException("boom")))).doesNotThrowAnyException();

		assertThat(meterRegistry.get("memory.task.failure").tag("task", "broken").counter().count())
			.isEqualTo(1.0);
	}

	@Test
	@DisplayName("Mono 생성 중 예외도 기록")
	void submit_supplierThrows_isRecorded() {
		executor.submit("supplier", () -> {
			throw new IllegalStateException("boom");
		});

		assertThat(meterRegistry.get("memory.task.failure").tag("task", "supplier").counter().count())
			.isEqualTo(1.0);
	}

	@Test
	@DisplayName("마감 시간을 넘긴 작업은 취소되고 기록")
	void submit_timeout_isRecorded() throws InterruptedException {
		MemoryTaskExecutor shortDeadline = new MemoryTaskExecutor(Schedulers.immediate(),
			Duration.ofMillis(50), new MemoryMetricsConfiguration(meterRegistry));

		shortDeadline.submit("slow", Mono::never);
		Thread.sleep(300);

		assertThat(meterRegistry.get("memory.task.failure").tag("task", "slow").counter().count())
			.isEqualTo(1.0);
	}

	@Test
	@DisplayName("잘못된 생성 인자 거부")
	void constructor_rejectsInvalidArguments() {
		MemoryMetricsConfiguration metrics = new MemoryMetricsConfiguration(meterRegistry);

		assertThatThrownBy(() -> new MemoryTaskExecutor(null, Duration.ofSeconds(1), metrics))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new MemoryTaskExecutor(Schedulers.immediate(), Duration.ZERO,
			metrics)).isInstanceOf(IllegalArgumentException.class);
	}
}

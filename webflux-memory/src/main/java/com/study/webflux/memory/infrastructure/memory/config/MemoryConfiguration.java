package com.study.webflux.memory.infrastructure.memory.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.ReactiveRedisConnectionFactory;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import com.study.webflux.memory.application.memory.support.MemoryTaskExecutor;
import com.study.webflux.memory.domain.memory.model.MemorySearchOptions;
import com.study.webflux.memory.domain.memory.service.MemoryContextFormatter;
import com.study.webflux.memory.domain.memory.service.RetrievalStrategySelector;
import com.study.webflux.memory.infrastructure.memory.adapter.vectordb.QdrantConfig;
import com.study.webflux.memory.infrastructure.memory.config.properties.MemoryProperties;
import com.study.webflux.memory.infrastructure.monitoring.config.MemoryMetricsConfiguration;
import com.study.webflux.memory.infrastructure.profile.adapter.ProfileExtractionConfig;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/** 기억 계층의 조회, 추출, 백그라운드 실행 설정을 제공합니다. */
@Configuration
public class MemoryConfiguration {

	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	/** 설정된 어휘로 조회 전략 판별기를 생성합니다. */
	@Bean
	public RetrievalStrategySelector retrievalStrategySelector(MemoryProperties properties) {
		return new RetrievalStrategySelector(properties.getStrategy().toPatterns());
	}

	@Bean
	public MemoryContextFormatter memoryContextFormatter(Clock clock) {
		return new MemoryContextFormatter(clock);
	}

	/** 프리셋에 개별 설정값을 덮어써 기본 검색 옵션을 만듭니다. */
	@Bean
	public MemorySearchOptions defaultMemorySearchOptions(MemoryProperties properties) {
		var search = properties.getSearch();
		MemorySearchOptions options = MemorySearchOptions.preset(search.getPreset())
			.withLocalScanLimit(search.getLocalScanLimit());

		if (search.getMaxLocalResults() != null || search.getMaxLongTermResults() != null) {
			options = options.withLimits(
				search.getMaxLocalResults() != null
					? search.getMaxLocalResults()
					: options.maxLocalResults(),
				search.getMaxLongTermResults() != null
					? search.getMaxLongTermResults()
					: options.maxLongTermResults());
		}
		if (search.getThreshold() != null) {
			options = options.withThreshold(search.getThreshold());
		}
		if (search.getSkipDurableIfLocalFound() != null || search.getMinLocalResultsForSkip() != null) {
			options = options.withDurableSkip(
				search.getSkipDurableIfLocalFound() != null
					? search.getSkipDurableIfLocalFound()
					: options.skipDurableIfLocalFound(),
				search.getMinLocalResultsForSkip() != null
					? search.getMinLocalResultsForSkip()
					: options.minLocalResultsForSkip());
		}
		return options;
	}

	/** 백그라운드 기억 작업 전용 스케줄러를 생성합니다. */
	@Bean(destroyMethod = "dispose")
	public Scheduler memoryTaskScheduler(MemoryProperties properties) {
		var tasks = properties.getTasks();
		return Schedulers.newBoundedElastic(tasks.getThreadCap(), tasks.getQueueCap(), "memory-task");
	}

	@Bean
	public MemoryTaskExecutor memoryTaskExecutor(Scheduler memoryTaskScheduler,
		MemoryProperties properties,
		MemoryMetricsConfiguration metrics) {
		return new MemoryTaskExecutor(memoryTaskScheduler,
			properties.getTimeouts().getBackgroundTask(), metrics);
	}

	@Bean
	public QdrantConfig qdrantConfig(MemoryProperties properties) {
		var qdrant = properties.getQdrant();
		return new QdrantConfig(qdrant.getUrl(), qdrant.getApiKey(), qdrant.getCollectionName(),
			qdrant.getVectorDimension(), qdrant.isAutoCreateCollection());
	}

	@Bean
	public ProfileExtractionConfig profileExtractionConfig(MemoryProperties properties) {
		return new ProfileExtractionConfig(properties.getProfile().getExtractionModel());
	}

	/** 최근 대화 캐시용 문자열 ReactiveRedisTemplate을 생성합니다. */
	@Bean
	@ConditionalOnProperty(name = "memory.cache.type", havingValue = "redis")
	public ReactiveRedisTemplate<String, String> recentContextRedisTemplate(
		ReactiveRedisConnectionFactory connectionFactory) {
		RedisSerializationContext<String, String> context = RedisSerializationContext
			.<String, String>newSerializationContext(new StringRedisSerializer())
			.value(new StringRedisSerializer())
			.build();

		return new ReactiveRedisTemplate<>(connectionFactory, context);
	}
}

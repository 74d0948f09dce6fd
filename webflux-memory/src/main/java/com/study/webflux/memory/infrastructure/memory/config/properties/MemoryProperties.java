package com.study.webflux.memory.infrastructure.memory.config.properties;

import java.time.Duration;
import java.util.List;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.study.webflux.memory.domain.memory.model.StrategyPatterns;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "memory")
public class MemoryProperties {

	@Valid
	private Session session = new Session();

	@Valid
	private Profile profile = new Profile();

	@Valid
	private Strategy strategy = new Strategy();

	@Valid
	private Search search = new Search();

	@Valid
	private Cache cache = new Cache();

	@Valid
	private Persistence persistence = new Persistence();

	@Valid
	private Timeouts timeouts = new Timeouts();

	@Valid
	private Qdrant qdrant = new Qdrant();

	@Valid
	private Tasks tasks = new Tasks();

	@Getter
	@Setter
	public static class Session {
		/** 마지막 활동 이후 세션을 정리 대상으로 보는 시간 */
		@NotNull
		private Duration inactivityWindow = Duration.ofMinutes(30);

		/** 미영속 세션을 경고 대상으로 보는 최대 보존 시간 */
		@NotNull
		private Duration maxRetention = Duration.ofHours(24);

		private Duration sweepInterval = Duration.ofMinutes(5);
	}

	@Getter
	@Setter
	public static class Profile {
		@Min(1)
		private int extractionInterval = 3;

		@NotBlank
		private String extractionModel = "gpt-4o-mini";
	}

	@Getter
	@Setter
	public static class Strategy {
		private List<String> greetings = StrategyPatterns.defaults().greetings();
		private List<String> acknowledgments = StrategyPatterns.defaults().acknowledgments();
		private List<String> memoryReferences = StrategyPatterns.defaults().memoryReferences();
		private List<String> personalInfo = StrategyPatterns.defaults().personalInfo();

		@Min(1)
		private int shortQueryLength = 30;

		@Min(0)
		private int earlyTurnLimit = 2;

		public StrategyPatterns toPatterns() {
			return new StrategyPatterns(greetings, acknowledgments, memoryReferences, personalInfo,
				shortQueryLength, earlyTurnLimit);
		}
	}

	@Getter
	@Setter
	public static class Search {
		/** balanced, cost-optimized, comprehensive 중 하나 */
		@NotBlank
		private String preset = "balanced";

		private Integer maxLocalResults;
		private Integer maxLongTermResults;

		@DecimalMin("0.0")
		@DecimalMax("1.0")
		private Float threshold;

		private Boolean skipDurableIfLocalFound;
		private Integer minLocalResultsForSkip;

		@Min(1)
		private int localScanLimit = 50;
	}

	@Getter
	@Setter
	public static class Cache {
		/** in-memory 또는 redis */
		@NotBlank
		private String type = "in-memory";

		@NotNull
		private Duration ttl = Duration.ofMinutes(2);

		@Min(1)
		private int turns = 5;

		@NotBlank
		private String keyPrefix = "memory:context:";
	}

	@Getter
	@Setter
	public static class Persistence {
		@NotNull
		private Duration cooldown = Duration.ofMinutes(2);

		@Min(1)
		private int maxBatchSize = 100;

		private boolean summaryEnabled = false;

		@NotBlank
		private String summaryModel = "gpt-4o-mini";
	}

	@Getter
	@Setter
	public static class Timeouts {
		@NotNull
		private Duration embedding = Duration.ofSeconds(10);

		@NotNull
		private Duration vectorStore = Duration.ofSeconds(10);

		@NotNull
		private Duration extraction = Duration.ofSeconds(30);

		@NotNull
		private Duration backgroundTask = Duration.ofSeconds(60);
	}

	@Getter
	@Setter
	public static class Qdrant {
		@NotBlank
		private String url = "http://localhost:6333";

		private String apiKey;

		@NotBlank
		private String collectionName = "chat_memory";

		@Min(1)
		private int vectorDimension = 1536;

		private boolean autoCreateCollection = true;
	}

	@Getter
	@Setter
	public static class Tasks {
		@Min(1)
		private int threadCap = 8;

		@Min(1)
		private int queueCap = 1000;
	}
}

package com.study.webflux.memory.domain.memory.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

import com.study.webflux.memory.domain.dialogue.model.ConversationTurn;
import com.study.webflux.memory.domain.memory.model.MemoryMatch;
import com.study.webflux.memory.domain.memory.model.MemoryRecordRole;
import com.study.webflux.memory.domain.profile.model.UserProfile;
import com.study.webflux.memory.domain.session.model.ConversationSummary;

/**
 * 조회 결과를 프롬프트에 붙일 텍스트 블록으로 렌더링합니다. 각 출처는 라벨이 붙은 섹션으로 구분됩니다.
 */
public class MemoryContextFormatter {

	public static final String SECTION_SEPARATOR = "\n\n" + "=".repeat(50) + "\n\n";

	private static final int MAX_CONTENT_LENGTH = 300;

	private final Clock clock;
	private final DateTimeFormatter dateFormatter;

	public MemoryContextFormatter(Clock clock) {
		this.clock = clock;
		this.dateFormatter = DateTimeFormatter.ISO_LOCAL_DATE.withZone(clock.getZone());
	}

	public String renderProfile(UserProfile profile) {
		if (profile == null || !profile.hasContent()) {
			return "";
		}
		List<String> sentences = new ArrayList<>();
		if (profile.name() != null) {
			sentences.add("The user's name is " + profile.name() + ".");
		}
		if (profile.role() != null) {
			sentences.add("They work as " + profile.role() + ".");
		}
		if (!profile.interests().isEmpty()) {
			sentences.add("Their interests include: " + String.join(", ", profile.interests()) + ".");
		}
		if (!profile.preferences().isEmpty()) {
			sentences.add("Preferences: " + String.join(", ", profile.preferences()) + ".");
		}
		if (profile.background() != null) {
			sentences.add("Background: " + profile.background());
		}
		if (profile.conversationStyle() != null) {
			sentences.add("Communication style: " + profile.conversationStyle());
		}
		return "--- USER PROFILE ---\n" + String.join(" ", sentences) + "\n--- END PROFILE ---";
	}

	public String renderRecentTurns(List<ConversationTurn> turns) {
		if (turns == null || turns.isEmpty()) {
			return "";
		}
		StringBuilder builder = new StringBuilder("RECENT CONVERSATIONS (")
			.append(turns.size())
			.append("):");
		for (ConversationTurn turn : turns) {
			builder.append("\n[")
				.append(formatTimeAgo(turn.timestamp()))
				.append("] User: ")
				.append(truncate(turn.userPrompt()))
				.append("\nAssistant: ")
				.append(truncate(turn.aiResponse()));
			if (turn.hasAttachment() && turn.attachment().prompt() != null) {
				builder.append("\n(Image generated: ").append(turn.attachment().prompt()).append(")");
			}
		}
		return builder.toString();
	}

	public String renderSummaries(List<ConversationSummary> summaries) {
		if (summaries == null || summaries.isEmpty()) {
			return "";
		}
		StringBuilder builder = new StringBuilder("CONVERSATION SUMMARIES (")
			.append(summaries.size())
			.append("):");
		for (ConversationSummary summary : summaries) {
			builder.append("\n[")
				.append(formatTimeAgo(summary.createdAt()))
				.append(", ")
				.append(summary.turnCount())
				.append(" turns] ")
				.append(summary.summary());
		}
		return builder.toString();
	}

	public String renderMatches(List<MemoryMatch> matches) {
		if (matches == null || matches.isEmpty()) {
			return "";
		}
		StringBuilder builder = new StringBuilder("RELEVANT PAST MEMORIES (")
			.append(matches.size())
			.append("):");
		for (MemoryMatch match : matches) {
			builder.append("\n[")
				.append(formatTimeAgo(match.metadata().timestamp()))
				.append(", ")
				.append(match.scorePercent())
				.append("% match] ")
				.append(speakerLabel(match.metadata().role()))
				.append(": ")
				.append(truncate(match.record().content()));
		}
		return builder.toString();
	}

	/**
	 * 비어 있지 않은 섹션만 구분선으로 이어 붙입니다. 모든 섹션이 비어 있으면 빈 문자열입니다.
	 */
	public String combine(String profileContext,
		List<ConversationTurn> localTurns,
		List<ConversationSummary> summaries,
		List<MemoryMatch> matches) {
		List<String> sections = new ArrayList<>();
		addIfPresent(sections, profileContext);
		addIfPresent(sections, renderRecentTurns(localTurns));
		addIfPresent(sections, renderSummaries(summaries));
		addIfPresent(sections, renderMatches(matches));
		return String.join(SECTION_SEPARATOR, sections);
	}

	public String formatTimeAgo(Instant timestamp) {
		Duration elapsed = Duration.between(timestamp, clock.instant());
		if (elapsed.isNegative() || elapsed.toMinutes() < 1) {
			return "just now";
		}
		if (elapsed.toMinutes() < 60) {
			return elapsed.toMinutes() + "m ago";
		}
		if (elapsed.toHours() < 24) {
			return elapsed.toHours() + "h ago";
		}
		if (elapsed.toDays() < 7) {
			return elapsed.toDays() + "d ago";
		}
		return dateFormatter.format(timestamp);
	}

	private static void addIfPresent(List<String> sections, String section) {
		if (section != null && !section.isBlank()) {
			sections.add(section);
		}
	}

	private static String speakerLabel(MemoryRecordRole role) {
		return switch (role) {
			case USER -> "User";
			case ASSISTANT -> "Assistant";
			case SUMMARY -> "Summary";
		};
	}

	private static String truncate(String content) {
		if (content.length() <= MAX_CONTENT_LENGTH) {
			return content;
		}
		return content.substring(0, MAX_CONTENT_LENGTH) + "...";
	}
}

package com.study.webflux.memory.domain.session.model;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

import com.study.webflux.memory.domain.dialogue.model.ConversationTurn;

/**
 * 같은 세션의 스냅샷들이 공유하는 추가 전용 턴 기록입니다.
 *
 * <p>
 * 각 스냅샷은 자신이 만들어진 시점의 길이만큼만 봅니다. 가장 최신 스냅샷 끝에 붙는 턴은 기록을 제자리에서 늘리고, 과거 스냅샷에서의 추가나 중간 삽입만
 * 새 기록으로 복사합니다.
 */
final class TurnLog {

	private final List<ConversationTurn> entries;

	private TurnLog(List<ConversationTurn> entries) {
		this.entries = entries;
	}

	/**
	 * 주어진 턴 목록의 불변 뷰를 반환합니다. 이미 기록 뷰라면 그대로 반환합니다.
	 */
	static List<ConversationTurn> viewOf(List<ConversationTurn> turns) {
		if (turns instanceof View) {
			return turns;
		}
		List<ConversationTurn> entries = new ArrayList<>(turns.size());
		for (ConversationTurn turn : turns) {
			entries.add(Objects.requireNonNull(turn, "turn cannot be null"));
		}
		return new View(new TurnLog(entries), entries.size());
	}

	static List<ConversationTurn> append(List<ConversationTurn> turns,
		ConversationTurn turn,
		Comparator<ConversationTurn> order) {
		View view = (View) viewOf(turns);
		return view.log.append(view.size, turn, order);
	}

	private synchronized List<ConversationTurn> append(int size,
		ConversationTurn turn,
		Comparator<ConversationTurn> order) {
		boolean atEnd = size == 0 || order.compare(entries.get(size - 1), turn) <= 0;
		if (atEnd && size == entries.size()) {
			entries.add(turn);
			return new View(this, size + 1);
		}

		List<ConversationTurn> forked = new ArrayList<>(size + 1);
		forked.addAll(entries.subList(0, size));
		int index = size;
		while (index > 0 && order.compare(forked.get(index - 1), turn) > 0) {
			index--;
		}
		forked.add(index, turn);
		return new View(new TurnLog(forked), forked.size());
	}

	private synchronized ConversationTurn get(int index) {
		return entries.get(index);
	}

	private static final class View extends AbstractList<ConversationTurn> implements RandomAccess {

		private final TurnLog log;
		private final int size;

		private View(TurnLog log, int size) {
			this.log = log;
			this.size = size;
		}

		@Override
		public ConversationTurn get(int index) {
			Objects.checkIndex(index, size);
			return log.get(index);
		}

		@Override
		public int size() {
			return size;
		}
	}
}

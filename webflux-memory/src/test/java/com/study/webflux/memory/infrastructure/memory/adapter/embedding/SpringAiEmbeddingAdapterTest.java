package com.study.webflux.memory.infrastructure.memory.adapter.embedding;

import java.util.List;

import org.springframework.ai.embedding.EmbeddingModel;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SpringAiEmbeddingAdapterTest {

	@Mock
	private EmbeddingModel embeddingModel;

	private SpringAiEmbeddingAdapter adapter;

	@BeforeEach
	void setUp() {
		adapter = new SpringAiEmbeddingAdapter(embeddingModel);
	}

	@Test
	@DisplayName("단일 텍스트 임베딩 성공")
	void embed_success() {
		when(embeddingModel.embed("pricing")).thenReturn(new float[] {0.1f, 0.2f});

		StepVerifier.create(adapter.embed("pricing")).assertNext(embedding -> {
			assertThat(embedding.text()).isEqualTo("pricing");
			assertThat(embedding.vector()).containsExactly(0.1f, 0.2f);
		}).verifyComplete();
	}

	@Test
	@DisplayName("빈 텍스트는 모델 호출 없이 거부")
	void embed_blank_fails() {
		StepVerifier.create(adapter.embed(" ")).expectError(IllegalArgumentException.class).verify();
	}

	@Test
	@DisplayName("여러 텍스트를 한 번의 호출로 순서대로 임베딩")
	void embedAll_singleCall() {
		when(embeddingModel.embed(List.of("a", "b")))
			.thenReturn(List.of(new float[] {1f}, new float[] {2f}));

		StepVerifier.create(adapter.embedAll(List.of("a", "b"))).assertNext(embeddings -> {
			assertThat(embeddings).extracting(embedding -> embedding.text()).containsExactly("a", "b");
			assertThat(embeddings.get(1).vector()).containsExactly(2f);
		}).verifyComplete();
	}

	@Test
	@DisplayName("모델 결과 개수가 다르면 실패")
	void embedAll_sizeMismatch_fails() {
		when(embeddingModel.embed(List.of("a", "b"))).thenReturn(List.of(new float[] {1f}));

		StepVerifier.create(adapter.embedAll(List.of("a", "b")))
			.expectError(IllegalStateException.class)
			.verify();
	}

	@Test
	@DisplayName("빈 목록은 모델 호출 없이 빈 결과")
	void embedAll_empty_returnsEmpty() {
		StepVerifier.create(adapter.embedAll(List.of()))
			.assertNext(embeddings -> assertThat(embeddings).isEmpty())
			.verifyComplete();

		verify(embeddingModel, never()).embed(anyList());
	}
}

package org.springaicommunity.github.changelog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("BatchStats Tests")
class BatchStatsTest {

	private static final Instant START = Instant.parse("2024-05-01T10:00:00Z");

	private static BatchStats withOutcomes(int total, int succeeded, int failed) {
		BatchStats stats = BatchStats.start(total, START);
		for (int i = 0; i < succeeded; i++) {
			stats = stats.record(ReleaseOutcome.succeeded("v" + i, false, 1));
		}
		for (int i = 0; i < failed; i++) {
			stats = stats.record(ReleaseOutcome.failed("f" + i, "boom", 0));
		}
		return stats;
	}

	@Nested
	@DisplayName("Success Threshold")
	class ThresholdTest {

		@Test
		@DisplayName("Should succeed at exactly the threshold")
		void shouldSucceedAtBoundary() {
			BatchStats stats = withOutcomes(10, 8, 2);

			assertThat(stats.successRate()).isEqualTo(0.8);
			assertThat(stats.isSuccessful(0.8)).isTrue();
		}

		@Test
		@DisplayName("Should fail just below the threshold")
		void shouldFailJustBelowBoundary() {
			assertThat(withOutcomes(10, 7, 3).isSuccessful(0.8)).isFalse();
			assertThat(withOutcomes(1000, 799, 201).isSuccessful(0.8)).isFalse();
		}

		@Test
		@DisplayName("Should treat skipped releases as not succeeded")
		void shouldNotCountSkippedAsSuccess() {
			BatchStats stats = withOutcomes(5, 3, 0).record(ReleaseOutcome.skipped("v9", "no optimization needed", 0))
				.record(ReleaseOutcome.skipped("v10", "empty commit range", 0));

			assertThat(stats.skipped()).isEqualTo(2);
			assertThat(stats.isSuccessful(0.8)).isFalse();
		}

		@Test
		@DisplayName("Should succeed for an empty batch")
		void shouldSucceedWhenEmpty() {
			BatchStats stats = BatchStats.start(0, START);

			assertThat(stats.successRate()).isEqualTo(1.0);
			assertThat(stats.isSuccessful(0.8)).isTrue();
		}

	}

	@Nested
	@DisplayName("Accumulation")
	class AccumulationTest {

		@Test
		@DisplayName("Should count outcomes and commits")
		void shouldAccumulate() {
			BatchStats stats = BatchStats.start(4, START)
				.record(ReleaseOutcome.succeeded("v1", true, 5))
				.record(ReleaseOutcome.succeeded("v2", false, 3))
				.record(ReleaseOutcome.skipped("v3", "no optimization needed", 0))
				.record(ReleaseOutcome.failed("v4", "boom", 2));

			assertThat(stats.processed()).isEqualTo(4);
			assertThat(stats.succeeded()).isEqualTo(2);
			assertThat(stats.aiSucceeded()).isEqualTo(1);
			assertThat(stats.skipped()).isEqualTo(1);
			assertThat(stats.failed()).isEqualTo(1);
			assertThat(stats.totalCommits()).isEqualTo(10);
			assertThat(stats.aiRate()).isEqualTo(0.5);
		}

		@Test
		@DisplayName("Should leave the previous accumulator unchanged")
		void shouldBeImmutable() {
			BatchStats initial = BatchStats.start(2, START);

			initial.record(ReleaseOutcome.succeeded("v1", true, 1));

			assertThat(initial.processed()).isZero();
		}

		@Test
		@DisplayName("Should report elapsed time since start")
		void shouldReportElapsed() {
			assertThat(BatchStats.start(1, START).elapsed(START.plusSeconds(90))).isEqualTo(Duration.ofSeconds(90));
		}

	}

}

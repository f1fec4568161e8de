package com.study.webflux.vitals.domain.history.model;

import java.time.Instant;
import java.util.List;

import com.study.webflux.vitals.fixture.CoreMetricsFixture;
import com.study.webflux.vitals.fixture.HistoricalDataPointFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoreMetricsTest {

	@Test
	@DisplayName("지표가 하나라도 빠지면 생성할 수 없다")
	void create_missingMetric_throws() {
		MetricSample sample = MetricSample.of(100, MetricRating.GOOD);

		assertThatThrownBy(() -> new CoreMetrics(sample, sample, sample, null, sample,
			CoreMetricsFixture.DEFAULT_TIMESTAMP))
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("inp");
	}

	@Test
	@DisplayName("지표별 접근자는 해당 지표 값을 돌려준다")
	void webVitalMetric_readsMatchingSample() {
		CoreMetrics metrics = CoreMetricsFixture.create(1, 2, 3, 4, 5);

		assertThat(List.of(WebVitalMetric.values()))
			.extracting(metric -> metric.valueOf(metrics))
			.containsExactly(1.0, 2.0, 3.0, 4.0, 5.0);
	}

	@Test
	@DisplayName("등급은 하이픈 표기로 변환된다")
	void metricRating_usesHyphenatedValues() {
		assertThat(MetricRating.NEEDS_IMPROVEMENT.value()).isEqualTo("needs-improvement");
		assertThat(MetricRating.fromValue("poor")).isEqualTo(MetricRating.POOR);
		assertThatThrownBy(() -> MetricRating.fromValue("average"))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("스냅샷에 시각을 붙이면 밀리초 단위로 잘린다")
	void snapshot_at_truncatesToMillis() {
		Instant precise = Instant.parse("2024-01-01T10:00:00.123456789Z");

		HistoricalDataPoint point = HistoricalDataPointFixture.snapshot().at(precise);

		assertThat(point.timestamp()).isEqualTo(Instant.parse("2024-01-01T10:00:00.123Z"));
	}

	@Test
	@DisplayName("프로젝트 ID가 없으면 default를 사용한다")
	void snapshot_defaultsProjectId() {
		PerformanceSnapshot snapshot = new PerformanceSnapshot(RenderingStrategy.SSG, null,
			CoreMetricsFixture.create(), null);

		assertThat(snapshot.projectId()).isEqualTo(ProjectId.DEFAULT);
		assertThat(ProjectId.ofNullable(" ")).isEqualTo(ProjectId.DEFAULT);
	}

	@Test
	@DisplayName("시작 시각이 종료 시각보다 늦은 범위 조회는 만들 수 없다")
	void timeRangeQuery_rejectsInvertedRange() {
		Instant now = Instant.parse("2024-01-02T00:00:00Z");

		assertThatThrownBy(() -> TimeRangeQuery.of(now, now.minusSeconds(1), null, null))
			.isInstanceOf(IllegalArgumentException.class);
		assertThat(TimeRangeQuery.allStrategies(now, now, null).targetStrategies())
			.containsExactly(RenderingStrategy.values());
	}
}

package com.study.webflux.vitals.application.history.service;

import java.time.Duration;
import java.time.Instant;

import com.study.webflux.vitals.domain.history.model.AggregatedBucket;
import com.study.webflux.vitals.domain.history.model.AggregationGranularity;
import com.study.webflux.vitals.domain.history.model.HistoricalDataPoint;
import com.study.webflux.vitals.domain.history.model.MetricStats;
import com.study.webflux.vitals.domain.history.model.PerformanceSnapshot;
import com.study.webflux.vitals.domain.history.model.ProjectId;
import com.study.webflux.vitals.domain.history.model.RenderingStrategy;
import com.study.webflux.vitals.domain.history.model.TimeRangeQuery;
import com.study.webflux.vitals.domain.history.model.WebVitalMetric;
import com.study.webflux.vitals.fixture.CoreMetricsFixture;
import com.study.webflux.vitals.fixture.HistoricalDataPointFixture;
import com.study.webflux.vitals.infrastructure.monitoring.config.HistoricalStoreMetricsConfiguration;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetricsAggregationServiceTest {

	private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
	private static final Instant END = Instant.parse("2024-01-31T23:59:59Z");

	@Mock
	private HistoricalRangeQueryService rangeQueryService;

	private SimpleMeterRegistry meterRegistry;
	private MetricsAggregationService aggregationService;

	@BeforeEach
	void setUp() {
		meterRegistry = new SimpleMeterRegistry();
		aggregationService = new MetricsAggregationService(rangeQueryService,
			new HistoricalStoreMetricsConfiguration(meterRegistry));
	}

	@Test
	@DisplayName("같은 버킷의 값으로 평균, 최소, 최대를 계산한다")
	void aggregate_computesStats() {
		when(rangeQueryService.query(any(TimeRangeQuery.class))).thenReturn(Flux.just(
			withFcp("2024-01-01T10:00:00Z", 1200),
			withFcp("2024-01-01T14:00:00Z", 1400)));

		StepVerifier.create(aggregate(AggregationGranularity.DAY))
			.assertNext(bucket -> {
				assertThat(bucket.timestamp()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
				assertThat(bucket.count()).isEqualTo(2);
				assertThat(bucket.statsOf(WebVitalMetric.FCP))
					.isEqualTo(new MetricStats(1300, 1200, 1400));
				assertThat(bucket.statsOf(WebVitalMetric.LCP))
					.isEqualTo(new MetricStats(2000, 2000, 2000));
				assertThat(bucket.metrics()).containsOnlyKeys(WebVitalMetric.values());
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("버킷 개수 합은 입력 포인트 수와 같고 버킷은 오름차순이다")
	void aggregate_conservesCountAndOrders() {
		when(rangeQueryService.query(any(TimeRangeQuery.class))).thenReturn(Flux.just(
			HistoricalDataPointFixture.create("2024-01-01T10:00:00Z"),
			HistoricalDataPointFixture.create("2024-01-01T10:30:00Z"),
			HistoricalDataPointFixture.create("2024-01-01T11:00:00Z"),
			HistoricalDataPointFixture.create("2024-01-03T00:00:00Z")));

		StepVerifier.create(aggregate(AggregationGranularity.HOUR).collectList())
			.assertNext(buckets -> {
				assertThat(buckets).extracting(AggregatedBucket::timestamp).containsExactly(
					Instant.parse("2024-01-01T10:00:00Z"),
					Instant.parse("2024-01-01T11:00:00Z"),
					Instant.parse("2024-01-03T00:00:00Z"));
				assertThat(buckets).extracting(AggregatedBucket::count).containsExactly(2, 1, 1);
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("버킷이 수백 개여도 모든 버킷을 오름차순으로 반환한다")
	void aggregate_manyHourlyBuckets() {
		Instant first = Instant.parse("2024-01-01T00:00:00Z");
		when(rangeQueryService.query(any(TimeRangeQuery.class))).thenReturn(
			Flux.range(0, 600)
				.map(hour -> HistoricalDataPointFixture.withLcp(first.plus(Duration.ofHours(hour)),
					2000)));

		StepVerifier.create(aggregate(AggregationGranularity.HOUR).collectList())
			.assertNext(buckets -> {
				assertThat(buckets).hasSize(600);
				assertThat(buckets.get(0).timestamp()).isEqualTo(first);
				assertThat(buckets.get(599).timestamp()).isEqualTo(first.plus(Duration.ofHours(599)));
				assertThat(buckets).allSatisfy(bucket -> assertThat(bucket.count()).isEqualTo(1));
			})
			.expectComplete()
			.verify(Duration.ofSeconds(5));
	}

	@Test
	@DisplayName("주 단위 집계는 ISO 월요일 자정에서 시작한다")
	void aggregate_weekStartsOnMonday() {
		when(rangeQueryService.query(any(TimeRangeQuery.class))).thenReturn(Flux.just(
			HistoricalDataPointFixture.create("2024-01-03T10:00:00Z"),
			HistoricalDataPointFixture.create("2024-01-07T23:00:00Z"),
			HistoricalDataPointFixture.create("2024-01-08T01:00:00Z")));

		StepVerifier.create(aggregate(AggregationGranularity.WEEK).collectList())
			.assertNext(buckets -> {
				assertThat(buckets).extracting(AggregatedBucket::timestamp).containsExactly(
					Instant.parse("2024-01-01T00:00:00Z"),
					Instant.parse("2024-01-08T00:00:00Z"));
				assertThat(buckets).extracting(AggregatedBucket::count).containsExactly(2, 1);
			})
			.verifyComplete();
	}

	@Test
	@DisplayName("조회 결과가 없으면 빈 결과를 반환한다")
	void aggregate_emptyInput() {
		when(rangeQueryService.query(any(TimeRangeQuery.class))).thenReturn(Flux.empty());

		StepVerifier.create(aggregate(AggregationGranularity.MONTH)).verifyComplete();
	}

	@Test
	@DisplayName("요청한 전략과 프로젝트로 범위 조회를 위임한다")
	void aggregate_delegatesQuery() {
		when(rangeQueryService.query(any(TimeRangeQuery.class))).thenReturn(Flux.empty());

		StepVerifier.create(aggregationService.aggregate(RenderingStrategy.ISR,
			ProjectId.of("shop"),
			AggregationGranularity.DAY,
			START,
			END)).verifyComplete();

		ArgumentCaptor<TimeRangeQuery> captor = ArgumentCaptor.forClass(TimeRangeQuery.class);
		verify(rangeQueryService).query(captor.capture());
		assertThat(captor.getValue()).isEqualTo(TimeRangeQuery.of(START, END, RenderingStrategy.ISR,
			ProjectId.of("shop")));
	}

	@Test
	@DisplayName("집계 중 오류가 나면 빈 결과를 반환하고 실패를 기록한다")
	void aggregate_error_returnsEmpty() {
		when(rangeQueryService.query(any(TimeRangeQuery.class)))
			.thenReturn(Flux.error(new IllegalStateException("boom")));

		StepVerifier.create(aggregate(AggregationGranularity.DAY)).verifyComplete();

		assertThat(meterRegistry.get("historical.store.failure")
			.tag("operation", "aggregate")
			.counter()
			.count()).isEqualTo(1);
	}

	private Flux<AggregatedBucket> aggregate(AggregationGranularity granularity) {
		return aggregationService.aggregate(RenderingStrategy.SSR, ProjectId.DEFAULT, granularity,
			START, END);
	}

	private static HistoricalDataPoint withFcp(String isoTimestamp, double fcp) {
		return PerformanceSnapshot.of(RenderingStrategy.SSR, ProjectId.DEFAULT,
			CoreMetricsFixture.withFcp(fcp)).at(Instant.parse(isoTimestamp));
	}
}

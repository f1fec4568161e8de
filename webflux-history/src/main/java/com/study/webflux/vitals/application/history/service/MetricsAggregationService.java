package com.study.webflux.vitals.application.history.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.vitals.domain.history.exception.StoreOperation;
import com.study.webflux.vitals.domain.history.model.AggregatedBucket;
import com.study.webflux.vitals.domain.history.model.AggregationGranularity;
import com.study.webflux.vitals.domain.history.model.HistoricalDataPoint;
import com.study.webflux.vitals.domain.history.model.MetricStats;
import com.study.webflux.vitals.domain.history.model.ProjectId;
import com.study.webflux.vitals.domain.history.model.RenderingStrategy;
import com.study.webflux.vitals.domain.history.model.TimeRangeQuery;
import com.study.webflux.vitals.domain.history.model.WebVitalMetric;
import com.study.webflux.vitals.infrastructure.monitoring.config.HistoricalStoreMetricsConfiguration;
import reactor.core.publisher.Flux;

/** 범위 조회 결과를 시간 버킷별 통계로 집계합니다. 집계는 요청 시점에 원본 데이터로 계산합니다. */
@Slf4j
@Service
@RequiredArgsConstructor
public class MetricsAggregationService {

	private final HistoricalRangeQueryService rangeQueryService;
	private final HistoricalStoreMetricsConfiguration storeMetrics;

	/**
	 * 버킷 시작 시각 오름차순으로 집계 결과를 반환합니다.
	 *
	 * @param granularity
	 *            HOUR, DAY, WEEK(ISO 월요일 시작), MONTH
	 * @return 데이터가 없거나 오류가 발생하면 빈 Flux
	 */
	public Flux<AggregatedBucket> aggregate(RenderingStrategy strategy,
		ProjectId projectId,
		AggregationGranularity granularity,
		Instant startDate,
		Instant endDate) {
		return Flux.defer(() -> rangeQueryService
			.query(TimeRangeQuery.of(startDate, endDate, strategy, projectId)))
			.collectList()
			.flatMapIterable(points -> toBuckets(points, granularity))
			.onErrorResume(error -> {
				log.error("이력 데이터 집계 실패 strategy={}, projectId={}, granularity={}, 이유={}",
					strategy,
					projectId.value(),
					granularity,
					error.getMessage(),
					error);
				storeMetrics.recordFailure(StoreOperation.AGGREGATE);
				return Flux.empty();
			});
	}

	/** 버킷 수에 상한이 없으므로 조회 결과를 메모리에서 버킷 시작 시각 순으로 묶습니다. */
	private static List<AggregatedBucket> toBuckets(List<HistoricalDataPoint> points,
		AggregationGranularity granularity) {
		Map<Instant, BucketAggregate> buckets = new TreeMap<>();
		for (HistoricalDataPoint point : points) {
			buckets.computeIfAbsent(granularity.bucketStart(point.timestamp()), BucketAggregate::new)
				.add(point);
		}
		return buckets.values().stream().map(BucketAggregate::toBucket).toList();
	}

	private static final class BucketAggregate {
		private final Instant bucketStart;
		private final Map<WebVitalMetric, List<Double>> values = new EnumMap<>(WebVitalMetric.class);
		private int count;

		private BucketAggregate(Instant bucketStart) {
			this.bucketStart = bucketStart;
			for (WebVitalMetric metric : WebVitalMetric.values()) {
				values.put(metric, new ArrayList<>());
			}
		}

		private BucketAggregate add(HistoricalDataPoint point) {
			count += 1;
			for (WebVitalMetric metric : WebVitalMetric.values()) {
				values.get(metric).add(point.valueOf(metric));
			}
			return this;
		}

		private AggregatedBucket toBucket() {
			Map<WebVitalMetric, MetricStats> stats = new EnumMap<>(WebVitalMetric.class);
			values.forEach((metric, metricValues) -> stats.put(metric, MetricStats.of(metricValues)));
			return new AggregatedBucket(bucketStart, count, stats);
		}
	}
}

package com.study.webflux.vitals.domain.history.port;

import java.time.Instant;
import java.util.Map;

import com.study.webflux.vitals.domain.history.model.AggregatedBucket;
import com.study.webflux.vitals.domain.history.model.AggregationGranularity;
import com.study.webflux.vitals.domain.history.model.HistoricalDataPoint;
import com.study.webflux.vitals.domain.history.model.PerformanceSnapshot;
import com.study.webflux.vitals.domain.history.model.ProjectId;
import com.study.webflux.vitals.domain.history.model.RegressionFinding;
import com.study.webflux.vitals.domain.history.model.RenderingStrategy;
import com.study.webflux.vitals.domain.history.model.TimeRangeQuery;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 성능 이력 저장/조회/분석 진입점입니다.
 *
 * <p>
 * 모든 연산은 내부 오류를 호출자에게 전파하지 않고 false, 빈 Mono, 빈 Flux로 변환합니다.
 */
public interface HistoricalMetricsUseCase {

	Mono<Boolean> save(PerformanceSnapshot snapshot);

	Mono<Boolean> save(PerformanceSnapshot snapshot, Instant timestamp);

	Mono<HistoricalDataPoint> get(RenderingStrategy strategy, ProjectId projectId);

	Mono<HistoricalDataPoint> get(RenderingStrategy strategy, ProjectId projectId, Instant date);

	Mono<Map<RenderingStrategy, HistoricalDataPoint>> getLatest(ProjectId projectId);

	Flux<HistoricalDataPoint> query(TimeRangeQuery query);

	Flux<AggregatedBucket> aggregate(RenderingStrategy strategy,
		ProjectId projectId,
		AggregationGranularity granularity,
		Instant startDate,
		Instant endDate);

	Flux<RegressionFinding> detectRegressions(RenderingStrategy strategy, ProjectId projectId);

	Flux<RegressionFinding> detectRegressions(RenderingStrategy strategy,
		ProjectId projectId,
		double threshold);
}

package com.study.webflux.vitals.application.history.service;

import java.time.Instant;
import java.util.Map;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Service;

import com.study.webflux.vitals.domain.history.model.AggregatedBucket;
import com.study.webflux.vitals.domain.history.model.AggregationGranularity;
import com.study.webflux.vitals.domain.history.model.HistoricalDataPoint;
import com.study.webflux.vitals.domain.history.model.PerformanceSnapshot;
import com.study.webflux.vitals.domain.history.model.ProjectId;
import com.study.webflux.vitals.domain.history.model.RegressionFinding;
import com.study.webflux.vitals.domain.history.model.RenderingStrategy;
import com.study.webflux.vitals.domain.history.model.TimeRangeQuery;
import com.study.webflux.vitals.domain.history.port.HistoricalMetricsUseCase;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Service
@RequiredArgsConstructor
public class HistoricalMetricsService implements HistoricalMetricsUseCase {

	private final HistoricalDataStore dataStore;
	private final HistoricalRangeQueryService rangeQueryService;
	private final MetricsAggregationService aggregationService;
	private final RegressionDetectionService regressionDetectionService;

	@Override
	public Mono<Boolean> save(PerformanceSnapshot snapshot) {
		return dataStore.save(snapshot);
	}

	@Override
	public Mono<Boolean> save(PerformanceSnapshot snapshot, Instant timestamp) {
		return dataStore.save(snapshot, timestamp);
	}

	@Override
	public Mono<HistoricalDataPoint> get(RenderingStrategy strategy, ProjectId projectId) {
		return dataStore.get(strategy, projectId);
	}

	@Override
	public Mono<HistoricalDataPoint> get(RenderingStrategy strategy,
		ProjectId projectId,
		Instant date) {
		return dataStore.get(strategy, projectId, date);
	}

	@Override
	public Mono<Map<RenderingStrategy, HistoricalDataPoint>> getLatest(ProjectId projectId) {
		return dataStore.getLatest(projectId);
	}

	@Override
	public Flux<HistoricalDataPoint> query(TimeRangeQuery query) {
		return rangeQueryService.query(query);
	}

	@Override
	public Flux<AggregatedBucket> aggregate(RenderingStrategy strategy,
		ProjectId projectId,
		AggregationGranularity granularity,
		Instant startDate,
		Instant endDate) {
		return aggregationService.aggregate(strategy, projectId, granularity, startDate, endDate);
	}

	@Override
	public Flux<RegressionFinding> detectRegressions(RenderingStrategy strategy,
		ProjectId projectId) {
		return regressionDetectionService.detectRegressions(strategy, projectId);
	}

	@Override
	public Flux<RegressionFinding> detectRegressions(RenderingStrategy strategy,
		ProjectId projectId,
		double threshold) {
		return regressionDetectionService.detectRegressions(strategy, projectId, threshold);
	}
}

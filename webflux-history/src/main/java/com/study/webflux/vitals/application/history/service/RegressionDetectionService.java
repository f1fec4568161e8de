package com.study.webflux.vitals.application.history.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.vitals.domain.history.exception.StoreOperation;
import com.study.webflux.vitals.domain.history.model.HistoricalDataPoint;
import com.study.webflux.vitals.domain.history.model.ProjectId;
import com.study.webflux.vitals.domain.history.model.RegressionFinding;
import com.study.webflux.vitals.domain.history.model.RegressionSplitMode;
import com.study.webflux.vitals.domain.history.model.RenderingStrategy;
import com.study.webflux.vitals.domain.history.model.TimeRangeQuery;
import com.study.webflux.vitals.domain.history.model.WebVitalMetric;
import com.study.webflux.vitals.infrastructure.history.config.RegressionDetectionConfig;
import com.study.webflux.vitals.infrastructure.monitoring.config.HistoricalStoreMetricsConfiguration;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 최근 구간의 지표 평균이 기준 구간보다 임계값 이상 나빠졌는지 감지합니다.
 *
 * <p>
 * 현재 시각부터 설정된 구간(기본 7일)을 조회한 뒤 앞쪽 절반을 기준, 뒤쪽 절반을 현재로 비교합니다. 모든 지표는 낮을수록 좋으므로 변화율이 양수면 악화입니다.
 */
@Slf4j
@Service
public class RegressionDetectionService {

	private static final int MIN_DATA_POINTS = 2;

	private final HistoricalRangeQueryService rangeQueryService;
	private final RegressionDetectionConfig config;
	private final HistoricalStoreMetricsConfiguration storeMetrics;
	private final Clock clock;

	public RegressionDetectionService(HistoricalRangeQueryService rangeQueryService,
		RegressionDetectionConfig config,
		HistoricalStoreMetricsConfiguration storeMetrics,
		Clock clock) {
		this.rangeQueryService = rangeQueryService;
		this.config = config;
		this.storeMetrics = storeMetrics;
		this.clock = clock;
	}

	public Flux<RegressionFinding> detectRegressions(RenderingStrategy strategy,
		ProjectId projectId) {
		return detectRegressions(strategy, projectId, config.defaultThreshold());
	}

	/**
	 * 회귀 지표를 지표 선언 순서(fcp, lcp, cls, inp, ttfb)로 반환합니다.
	 *
	 * @param threshold
	 *            악화로 판단할 최소 변화율 (0.2 = 20%)
	 * @return 데이터 포인트가 2개 미만이거나 오류가 발생하면 빈 Flux
	 */
	public Flux<RegressionFinding> detectRegressions(RenderingStrategy strategy,
		ProjectId projectId,
		double threshold) {
		return Mono.fromCallable(clock::instant)
			.flatMapMany(now -> {
				Instant windowStart = now.minus(config.window());
				return rangeQueryService
					.query(TimeRangeQuery.of(windowStart, now, strategy, projectId))
					.collectList()
					.flatMapIterable(points -> findRegressions(points,
						windowStart,
						now,
						threshold));
			})
			.onErrorResume(error -> {
				log.error("회귀 감지 실패 strategy={}, projectId={}, 이유={}",
					strategy,
					projectId.value(),
					error.getMessage(),
					error);
				storeMetrics.recordFailure(StoreOperation.DETECT_REGRESSIONS);
				return Flux.empty();
			});
	}

	private List<RegressionFinding> findRegressions(List<HistoricalDataPoint> points,
		Instant windowStart,
		Instant windowEnd,
		double threshold) {
		if (points.size() < MIN_DATA_POINTS) {
			return List.of();
		}

		List<HistoricalDataPoint> baseline;
		List<HistoricalDataPoint> current;
		if (config.splitMode() == RegressionSplitMode.CALENDAR) {
			Instant midpoint = windowStart.plus(Duration.between(windowStart, windowEnd).dividedBy(2));
			baseline = points.stream().filter(p -> p.timestamp().isBefore(midpoint)).toList();
			current = points.stream().filter(p -> !p.timestamp().isBefore(midpoint)).toList();
			if (baseline.isEmpty() || current.isEmpty()) {
				return List.of();
			}
		} else {
			int mid = points.size() / 2;
			baseline = points.subList(0, mid);
			current = points.subList(mid, points.size());
		}

		List<RegressionFinding> regressions = new ArrayList<>();
		for (WebVitalMetric metric : WebVitalMetric.values()) {
			double baselineAvg = average(baseline, metric);
			double currentAvg = average(current, metric);

			if (baselineAvg == 0) {
				if (currentAvg != 0) {
					log.debug("기준 평균이 0이어서 변화율을 계산할 수 없습니다. metric={}, current={}",
						metric.metricName(),
						currentAvg);
				}
				continue;
			}

			double change = (currentAvg - baselineAvg) / baselineAvg;
			if (change > threshold) {
				regressions.add(new RegressionFinding(metric, baselineAvg, currentAvg, change));
			}
		}
		return regressions;
	}

	private static double average(List<HistoricalDataPoint> points, WebVitalMetric metric) {
		return points.stream().mapToDouble(point -> point.valueOf(metric)).average().orElse(0);
	}
}

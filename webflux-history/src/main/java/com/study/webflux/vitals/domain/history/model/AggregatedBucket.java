package com.study.webflux.vitals.domain.history.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** 하나의 집계 버킷에 대한 지표별 통계입니다. */
public record AggregatedBucket(
	Instant timestamp,
	int count,
	Map<WebVitalMetric, MetricStats> metrics
) {
	public AggregatedBucket {
		metrics = Collections.unmodifiableMap(new EnumMap<>(metrics));
	}

	public MetricStats statsOf(WebVitalMetric metric) {
		return metrics.getOrDefault(metric, MetricStats.EMPTY);
	}
}

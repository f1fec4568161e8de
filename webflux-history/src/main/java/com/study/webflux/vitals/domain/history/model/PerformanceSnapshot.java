package com.study.webflux.vitals.domain.history.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 아직 측정 시각이 정해지지 않은 저장 요청입니다.
 *
 * <p>
 * 저장 시점에 {@link #at(Instant)}로 시각을 붙여 {@link HistoricalDataPoint}가 됩니다.
 */
public record PerformanceSnapshot(
	RenderingStrategy strategy,
	ProjectId projectId,
	CoreMetrics metrics,
	Map<String, Object> metadata
) {
	public PerformanceSnapshot {
		if (strategy == null) {
			throw new IllegalArgumentException("strategy cannot be null");
		}
		if (metrics == null) {
			throw new IllegalArgumentException("metrics cannot be null");
		}
		projectId = projectId == null ? ProjectId.defaultProject() : projectId;
		metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
	}

	public static PerformanceSnapshot of(RenderingStrategy strategy,
		ProjectId projectId,
		CoreMetrics metrics) {
		return new PerformanceSnapshot(strategy, projectId, metrics, null);
	}

	public HistoricalDataPoint at(Instant timestamp) {
		return new HistoricalDataPoint(timestamp.truncatedTo(ChronoUnit.MILLIS),
			strategy,
			projectId,
			metrics,
			metadata);
	}
}

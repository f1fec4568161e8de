package com.study.webflux.vitals.domain.history.model;

import java.time.Instant;
import java.util.Map;

/**
 * 저장소에 보관되는 성능 측정 단위입니다.
 *
 * <p>
 * timestamp는 실제 측정 시각이며, 저장 키의 날짜 구간과는 별개로 범위 조회 필터에 사용됩니다. metadata는 출처 URL, 환경, User-Agent 등 이
 * 모듈이 해석하지 않는 부가 정보입니다.
 */
public record HistoricalDataPoint(
	Instant timestamp,
	RenderingStrategy strategy,
	ProjectId projectId,
	CoreMetrics metrics,
	Map<String, Object> metadata
) {
	public HistoricalDataPoint {
		if (timestamp == null) {
			throw new IllegalArgumentException("timestamp cannot be null");
		}
		if (strategy == null) {
			throw new IllegalArgumentException("strategy cannot be null");
		}
		if (metrics == null) {
			throw new IllegalArgumentException("metrics cannot be null");
		}
		projectId = projectId == null ? ProjectId.defaultProject() : projectId;
	}

	public boolean isWithin(Instant start, Instant end) {
		return !timestamp.isBefore(start) && !timestamp.isAfter(end);
	}

	public double valueOf(WebVitalMetric metric) {
		return metric.valueOf(metrics);
	}
}

package com.study.webflux.vitals.domain.history.model;

import java.util.List;

public record MetricStats(
	double avg,
	double min,
	double max
) {
	public static final MetricStats EMPTY = new MetricStats(0, 0, 0);

	/** 값 목록의 산술 평균, 최솟값, 최댓값을 계산합니다. 값이 없으면 모두 0입니다. */
	public static MetricStats of(List<Double> values) {
		if (values == null || values.isEmpty()) {
			return EMPTY;
		}
		double sum = 0;
		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for (double value : values) {
			sum += value;
			min = Math.min(min, value);
			max = Math.max(max, value);
		}
		return new MetricStats(sum / values.size(), min, max);
	}
}

package com.study.webflux.vitals.domain.history.model;

/**
 * 기준 구간 대비 최근 구간 평균이 악화된 지표입니다.
 *
 * @param change
 *            기준 평균 대비 현재 평균의 변화율 ((current - baseline) / baseline)
 */
public record RegressionFinding(
	WebVitalMetric metric,
	double baseline,
	double current,
	double change
) {
	public String metricName() {
		return metric.metricName();
	}
}

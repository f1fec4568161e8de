package com.study.webflux.vitals.domain.history.model;

/**
 * 한 번의 측정에서 얻은 Core Web Vitals 묶음입니다.
 *
 * <p>
 * 다섯 지표가 모두 있어야 생성할 수 있습니다. timestamp는 측정 도구가 기록한 ISO-8601 문자열을 그대로 보존합니다.
 */
public record CoreMetrics(
	MetricSample fcp,
	MetricSample lcp,
	MetricSample cls,
	MetricSample inp,
	MetricSample ttfb,
	String timestamp
) {
	public CoreMetrics {
		requirePresent(fcp, WebVitalMetric.FCP);
		requirePresent(lcp, WebVitalMetric.LCP);
		requirePresent(cls, WebVitalMetric.CLS);
		requirePresent(inp, WebVitalMetric.INP);
		requirePresent(ttfb, WebVitalMetric.TTFB);
	}

	private static void requirePresent(MetricSample sample, WebVitalMetric metric) {
		if (sample == null) {
			throw new IllegalArgumentException(
				"metrics must contain " + metric.metricName());
		}
	}
}

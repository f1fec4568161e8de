package com.study.webflux.vitals.domain.history.model;

import java.util.Locale;
import java.util.function.Function;

/**
 * 스냅샷마다 추적하는 다섯 가지 Core Web Vitals 지표입니다.
 *
 * <p>
 * 모든 지표는 값이 낮을수록 좋습니다.
 */
public enum WebVitalMetric {
	FCP(CoreMetrics::fcp),
	LCP(CoreMetrics::lcp),
	CLS(CoreMetrics::cls),
	INP(CoreMetrics::inp),
	TTFB(CoreMetrics::ttfb);

	private final Function<CoreMetrics, MetricSample> accessor;

	WebVitalMetric(Function<CoreMetrics, MetricSample> accessor) {
		this.accessor = accessor;
	}

	public MetricSample sampleOf(CoreMetrics metrics) {
		return accessor.apply(metrics);
	}

	public double valueOf(CoreMetrics metrics) {
		return sampleOf(metrics).value();
	}

	/** 직렬화 및 결과 보고에 사용하는 소문자 이름입니다. */
	public String metricName() {
		return name().toLowerCase(Locale.ROOT);
	}
}

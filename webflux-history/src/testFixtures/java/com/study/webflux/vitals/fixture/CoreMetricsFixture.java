package com.study.webflux.vitals.fixture;

import com.study.webflux.vitals.domain.history.model.CoreMetrics;
import com.study.webflux.vitals.domain.history.model.MetricRating;
import com.study.webflux.vitals.domain.history.model.MetricSample;

public final class CoreMetricsFixture {

	public static final String DEFAULT_TIMESTAMP = "2024-01-01T12:00:00.000Z";

	private CoreMetricsFixture() {
	}

	public static CoreMetrics create() {
		return create(1200, 2000, 0.05, 150, 500);
	}

	public static CoreMetrics withLcp(double lcp) {
		return create(1200, lcp, 0.05, 150, 500);
	}

	public static CoreMetrics withFcp(double fcp) {
		return create(fcp, 2000, 0.05, 150, 500);
	}

	public static CoreMetrics create(double fcp, double lcp, double cls, double inp, double ttfb) {
		return new CoreMetrics(
			MetricSample.of(fcp, MetricRating.GOOD),
			MetricSample.of(lcp, MetricRating.GOOD),
			MetricSample.of(cls, MetricRating.GOOD),
			MetricSample.of(inp, MetricRating.GOOD),
			MetricSample.of(ttfb, MetricRating.GOOD),
			DEFAULT_TIMESTAMP);
	}
}

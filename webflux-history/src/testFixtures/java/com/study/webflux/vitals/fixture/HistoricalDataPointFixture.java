package com.study.webflux.vitals.fixture;

import java.time.Instant;

import com.study.webflux.vitals.domain.history.model.CoreMetrics;
import com.study.webflux.vitals.domain.history.model.HistoricalDataPoint;
import com.study.webflux.vitals.domain.history.model.PerformanceSnapshot;
import com.study.webflux.vitals.domain.history.model.ProjectId;
import com.study.webflux.vitals.domain.history.model.RenderingStrategy;

public final class HistoricalDataPointFixture {

	public static final RenderingStrategy DEFAULT_STRATEGY = RenderingStrategy.SSR;

	private HistoricalDataPointFixture() {
	}

	public static PerformanceSnapshot snapshot() {
		return PerformanceSnapshot.of(DEFAULT_STRATEGY, ProjectId.defaultProject(),
			CoreMetricsFixture.create());
	}

	public static PerformanceSnapshot snapshot(RenderingStrategy strategy, CoreMetrics metrics) {
		return PerformanceSnapshot.of(strategy, ProjectId.defaultProject(), metrics);
	}

	public static HistoricalDataPoint create(String isoTimestamp) {
		return snapshot().at(Instant.parse(isoTimestamp));
	}

	public static HistoricalDataPoint withLcp(String isoTimestamp, double lcp) {
		return snapshot(DEFAULT_STRATEGY, CoreMetricsFixture.withLcp(lcp))
			.at(Instant.parse(isoTimestamp));
	}

	public static HistoricalDataPoint withLcp(Instant timestamp, double lcp) {
		return snapshot(DEFAULT_STRATEGY, CoreMetricsFixture.withLcp(lcp)).at(timestamp);
	}

	public static HistoricalDataPoint create(RenderingStrategy strategy, String isoTimestamp) {
		return snapshot(strategy, CoreMetricsFixture.create()).at(Instant.parse(isoTimestamp));
	}
}

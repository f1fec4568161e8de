package com.study.webflux.vitals.infrastructure.history.config;

import java.time.Duration;

import com.study.webflux.vitals.domain.history.model.RegressionSplitMode;

public record RegressionDetectionConfig(
	Duration window,
	double defaultThreshold,
	RegressionSplitMode splitMode
) {
	public static RegressionDetectionConfig defaults() {
		return new RegressionDetectionConfig(Duration.ofDays(7), 0.2, RegressionSplitMode.POSITIONAL);
	}
}

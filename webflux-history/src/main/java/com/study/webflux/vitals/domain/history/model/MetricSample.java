package com.study.webflux.vitals.domain.history.model;

public record MetricSample(
	double value,
	MetricRating rating,
	double delta
) {
	public MetricSample {
		if (rating == null) {
			throw new IllegalArgumentException("rating cannot be null");
		}
	}

	public static MetricSample of(double value, MetricRating rating) {
		return new MetricSample(value, rating, 0);
	}
}

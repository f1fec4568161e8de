package com.study.webflux.vitals.domain.history.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Web Vitals 측정값의 등급입니다. */
public enum MetricRating {
	GOOD("good"),
	NEEDS_IMPROVEMENT("needs-improvement"),
	POOR("poor");

	private final String value;

	MetricRating(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}

	@JsonCreator
	public static MetricRating fromValue(String value) {
		for (MetricRating rating : values()) {
			if (rating.value.equals(value)) {
				return rating;
			}
		}
		throw new IllegalArgumentException("Unknown metric rating: " + value);
	}
}

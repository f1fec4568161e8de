package com.study.webflux.vitals.domain.history.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/** 집계 버킷 단위입니다. 모든 경계는 UTC 달력 기준으로 계산합니다. */
public enum AggregationGranularity {
	HOUR,
	DAY,
	WEEK,
	MONTH;

	/** 주어진 시각이 속한 버킷의 시작 시각을 반환합니다. */
	public Instant bucketStart(Instant instant) {
		ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
		return switch (this) {
			case HOUR -> instant.truncatedTo(ChronoUnit.HOURS);
			case DAY -> instant.truncatedTo(ChronoUnit.DAYS);
			case WEEK -> utc.truncatedTo(ChronoUnit.DAYS)
				.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
				.toInstant();
			case MONTH -> utc.truncatedTo(ChronoUnit.DAYS)
				.with(TemporalAdjusters.firstDayOfMonth())
				.toInstant();
		};
	}

	public String keySegment() {
		return name().toLowerCase(Locale.ROOT);
	}
}

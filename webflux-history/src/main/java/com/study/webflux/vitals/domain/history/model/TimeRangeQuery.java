package com.study.webflux.vitals.domain.history.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 시간 범위 조회 조건입니다. start와 end는 모두 포함 구간입니다.
 *
 * <p>
 * strategy가 없으면 모든 렌더링 전략을 조회합니다.
 */
public record TimeRangeQuery(
	Instant startDate,
	Instant endDate,
	RenderingStrategy strategy,
	ProjectId projectId
) {
	public TimeRangeQuery {
		if (startDate == null || endDate == null) {
			throw new IllegalArgumentException("startDate and endDate are required");
		}
		if (startDate.isAfter(endDate)) {
			throw new IllegalArgumentException("startDate must not be after endDate");
		}
		projectId = projectId == null ? ProjectId.defaultProject() : projectId;
	}

	public static TimeRangeQuery of(Instant startDate,
		Instant endDate,
		RenderingStrategy strategy,
		ProjectId projectId) {
		return new TimeRangeQuery(startDate, endDate, strategy, projectId);
	}

	public static TimeRangeQuery allStrategies(Instant startDate,
		Instant endDate,
		ProjectId projectId) {
		return new TimeRangeQuery(startDate, endDate, null, projectId);
	}

	public Optional<RenderingStrategy> strategyFilter() {
		return Optional.ofNullable(strategy);
	}

	/** 키 탐색 대상 전략 목록을 반환합니다. */
	public List<RenderingStrategy> targetStrategies() {
		return strategy == null ? List.of(RenderingStrategy.values()) : List.of(strategy);
	}

	public boolean contains(HistoricalDataPoint point) {
		return point.isWithin(startDate, endDate);
	}
}

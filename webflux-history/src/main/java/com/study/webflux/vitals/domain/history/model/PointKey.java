package com.study.webflux.vitals.domain.history.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;

/**
 * 저장 키를 해석한 결과입니다.
 *
 * <p>
 * 일 단위 키(이전 형식)는 epochMillis가 비어 있습니다.
 */
public record PointKey(
	ProjectId projectId,
	RenderingStrategy strategy,
	LocalDate day,
	Optional<Long> epochMillis
) {
	public boolean isLegacyDayKey() {
		return epochMillis.isEmpty();
	}

	public Optional<Instant> timestamp() {
		return epochMillis.map(Instant::ofEpochMilli);
	}
}

package com.study.webflux.vitals.infrastructure.history.serialization;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.study.webflux.vitals.domain.history.model.CoreMetrics;
import com.study.webflux.vitals.domain.history.model.HistoricalDataPoint;
import com.study.webflux.vitals.domain.history.model.ProjectId;
import com.study.webflux.vitals.domain.history.model.RenderingStrategy;

/**
 * 저장소에 기록되는 JSON 문서 형태입니다.
 *
 * <p>
 * timestamp는 epoch 밀리초 숫자, strategy는 대문자 이름으로 기록합니다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record HistoricalDataPointDocument(
	long timestamp,
	String strategy,
	String projectId,
	CoreMetrics metrics,
	Map<String, Object> metadata
) {
	public static HistoricalDataPointDocument fromDomain(HistoricalDataPoint point) {
		return new HistoricalDataPointDocument(
			point.timestamp().toEpochMilli(),
			point.strategy().name(),
			point.projectId().value(),
			point.metrics(),
			point.metadata());
	}

	public HistoricalDataPoint toDomain() {
		return new HistoricalDataPoint(
			Instant.ofEpochMilli(timestamp),
			RenderingStrategy.valueOf(strategy),
			ProjectId.ofNullable(projectId),
			metrics,
			metadata);
	}
}

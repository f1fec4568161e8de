package com.study.webflux.vitals.infrastructure.history.serialization;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.vitals.domain.history.exception.HistoricalStoreException;
import com.study.webflux.vitals.domain.history.exception.StoreOperation;
import com.study.webflux.vitals.domain.history.model.HistoricalDataPoint;

/** 데이터 포인트와 저장용 JSON 문자열을 상호 변환합니다. */
@Component
@RequiredArgsConstructor
public class HistoricalDataPointJsonCodec {

	private final ObjectMapper objectMapper;

	public String encode(HistoricalDataPoint point) {
		try {
			return objectMapper.writeValueAsString(HistoricalDataPointDocument.fromDomain(point));
		} catch (JsonProcessingException e) {
			throw new HistoricalStoreException(StoreOperation.SERIALIZE,
				"데이터 포인트 직렬화 실패: " + e.getOriginalMessage(),
				e);
		}
	}

	/** 저장된 JSON을 해석합니다. 형식이 잘못되었거나 필수 지표가 없으면 예외가 발생합니다. */
	public HistoricalDataPoint decode(String json) {
		try {
			return objectMapper.readValue(json, HistoricalDataPointDocument.class).toDomain();
		} catch (JsonProcessingException | IllegalArgumentException e) {
			throw new HistoricalStoreException(StoreOperation.DESERIALIZE,
				"저장된 데이터 포인트 해석 실패: " + e.getMessage(),
				e);
		}
	}
}

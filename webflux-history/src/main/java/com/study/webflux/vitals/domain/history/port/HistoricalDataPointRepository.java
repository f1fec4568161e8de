package com.study.webflux.vitals.domain.history.port;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import com.study.webflux.vitals.domain.history.model.HistoricalDataPoint;
import com.study.webflux.vitals.domain.history.model.ProjectId;
import com.study.webflux.vitals.domain.history.model.RenderingStrategy;
import reactor.core.publisher.Mono;

/**
 * 데이터 포인트 영속화 포트입니다.
 *
 * <p>
 * 실패는 오류 신호로 그대로 전달하며, 센티널 변환은 호출하는 서비스가 담당합니다.
 */
public interface HistoricalDataPointRepository {

	Mono<Boolean> save(HistoricalDataPoint point, Duration ttl);

	/**
	 * 전략별로 키를 탐색한 뒤 한 번의 일괄 조회로 데이터 포인트를 가져옵니다. 결과 순서는 보장하지 않습니다.
	 */
	Mono<List<HistoricalDataPoint>> findAllByStrategies(List<RenderingStrategy> strategies,
		ProjectId projectId);

	/** 특정 UTC 날짜에 저장된 데이터 포인트를 가져옵니다. */
	Mono<List<HistoricalDataPoint>> findAllByDay(RenderingStrategy strategy,
		ProjectId projectId,
		Instant date);
}

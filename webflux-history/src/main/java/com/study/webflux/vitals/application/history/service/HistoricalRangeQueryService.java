package com.study.webflux.vitals.application.history.service;

import java.util.Comparator;
import java.util.List;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.vitals.domain.history.exception.StoreOperation;
import com.study.webflux.vitals.domain.history.model.HistoricalDataPoint;
import com.study.webflux.vitals.domain.history.model.TimeRangeQuery;
import com.study.webflux.vitals.domain.history.port.HistoricalDataPointRepository;
import com.study.webflux.vitals.infrastructure.monitoring.config.HistoricalStoreMetricsConfiguration;
import reactor.core.publisher.Flux;

/**
 * 시간 범위 조회를 담당합니다. 집계와 회귀 감지가 이 결과를 공유합니다.
 *
 * <p>
 * 키는 날짜 단위로 탐색하지만 범위 필터는 실제 측정 시각(밀리초)으로 적용하므로 하루 안의 부분 구간도 정확히 걸러집니다. 키 탐색과 일괄 조회 사이에
 * 기록된 데이터는 포함되지 않을 수 있습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoricalRangeQueryService {

	private final HistoricalDataPointRepository repository;
	private final HistoricalStoreMetricsConfiguration storeMetrics;

	/**
	 * 범위 안의 데이터 포인트를 측정 시각 오름차순으로 반환합니다.
	 *
	 * @return 오류가 발생하면 빈 Flux
	 */
	public Flux<HistoricalDataPoint> query(TimeRangeQuery query) {
		return repository.findAllByStrategies(query.targetStrategies(), query.projectId())
			.map(points -> inRangeSorted(points, query))
			.doOnNext(points -> storeMetrics.recordQueriedPoints(points.size()))
			.flatMapIterable(points -> points)
			.onErrorResume(error -> {
				log.error("이력 데이터 범위 조회 실패 start={}, end={}, strategy={}, projectId={}, 이유={}",
					query.startDate(),
					query.endDate(),
					query.strategy(),
					query.projectId().value(),
					error.getMessage(),
					error);
				storeMetrics.recordFailure(StoreOperation.QUERY);
				return Flux.empty();
			});
	}

	private List<HistoricalDataPoint> inRangeSorted(List<HistoricalDataPoint> points,
		TimeRangeQuery query) {
		return points.stream()
			.filter(query::contains)
			.sorted(Comparator.comparing(HistoricalDataPoint::timestamp))
			.toList();
	}
}

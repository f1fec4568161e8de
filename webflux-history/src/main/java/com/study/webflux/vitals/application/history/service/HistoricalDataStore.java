package com.study.webflux.vitals.application.history.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.vitals.domain.history.exception.StoreOperation;
import com.study.webflux.vitals.domain.history.model.HistoricalDataPoint;
import com.study.webflux.vitals.domain.history.model.PerformanceSnapshot;
import com.study.webflux.vitals.domain.history.model.ProjectId;
import com.study.webflux.vitals.domain.history.model.RenderingStrategy;
import com.study.webflux.vitals.domain.history.port.HistoricalDataPointRepository;
import com.study.webflux.vitals.infrastructure.history.config.HistoricalStoreConfig;
import com.study.webflux.vitals.infrastructure.monitoring.config.HistoricalStoreMetricsConfiguration;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 데이터 포인트 단건 저장/조회를 담당합니다.
 *
 * <p>
 * 저장 실패는 false, 조회 실패는 빈 Mono로 변환하고 로그와 실패 메트릭만 남깁니다.
 */
@Slf4j
@Service
public class HistoricalDataStore {

	private final HistoricalDataPointRepository repository;
	private final HistoricalStoreConfig config;
	private final HistoricalStoreMetricsConfiguration storeMetrics;
	private final Clock clock;

	public HistoricalDataStore(HistoricalDataPointRepository repository,
		HistoricalStoreConfig config,
		HistoricalStoreMetricsConfiguration storeMetrics,
		Clock clock) {
		this.repository = repository;
		this.config = config;
		this.storeMetrics = storeMetrics;
		this.clock = clock;
	}

	/** 현재 시각을 측정 시각으로 사용해 저장합니다. */
	public Mono<Boolean> save(PerformanceSnapshot snapshot) {
		return Mono.defer(() -> save(snapshot, clock.instant()));
	}

	/**
	 * 측정 시각을 붙여 데이터 포인트를 저장합니다. 보관 기간이 지나면 저장소에서 만료됩니다.
	 *
	 * @return 저장 성공 여부. 오류가 발생해도 예외 대신 false를 반환합니다.
	 */
	public Mono<Boolean> save(PerformanceSnapshot snapshot, Instant timestamp) {
		return Mono.fromCallable(() -> snapshot.at(timestamp))
			.flatMap(point -> repository.save(point, config.retention()))
			.defaultIfEmpty(false)
			.doOnNext(saved -> {
				if (saved) {
					storeMetrics.recordSaved();
				}
			})
			.onErrorResume(error -> {
				log.error("이력 데이터 저장 실패 strategy={}, projectId={}, 이유={}",
					snapshot.strategy(),
					snapshot.projectId().value(),
					error.getMessage(),
					error);
				storeMetrics.recordFailure(StoreOperation.SAVE);
				return Mono.just(false);
			});
	}

	/** 오늘(UTC) 저장된 가장 최근 데이터 포인트를 조회합니다. */
	public Mono<HistoricalDataPoint> get(RenderingStrategy strategy, ProjectId projectId) {
		return Mono.defer(() -> get(strategy, projectId, clock.instant()));
	}

	/**
	 * 지정한 날짜(UTC)에 저장된 데이터 포인트 중 측정 시각이 가장 늦은 것을 조회합니다.
	 *
	 * @return 데이터가 없거나 오류가 발생하면 빈 Mono
	 */
	public Mono<HistoricalDataPoint> get(RenderingStrategy strategy,
		ProjectId projectId,
		Instant date) {
		return repository.findAllByDay(strategy, projectId, date)
			.flatMap(points -> Mono.justOrEmpty(points.stream()
				.max(Comparator.comparing(HistoricalDataPoint::timestamp))))
			.onErrorResume(error -> {
				log.error("이력 데이터 조회 실패 strategy={}, projectId={}, date={}, 이유={}",
					strategy,
					projectId.value(),
					date,
					error.getMessage(),
					error);
				storeMetrics.recordFailure(StoreOperation.GET);
				return Mono.empty();
			});
	}

	/** 모든 렌더링 전략에 대해 오늘 저장된 최신 데이터 포인트를 모읍니다. 데이터가 없는 전략은 결과에서 빠집니다. */
	public Mono<Map<RenderingStrategy, HistoricalDataPoint>> getLatest(ProjectId projectId) {
		return Mono.defer(() -> {
			Instant today = clock.instant();
			return Flux.fromArray(RenderingStrategy.values())
				.concatMap(strategy -> get(strategy, projectId, today))
				.collectMap(HistoricalDataPoint::strategy,
					point -> point,
					() -> new EnumMap<RenderingStrategy, HistoricalDataPoint>(
						RenderingStrategy.class));
		});
	}
}

package com.study.webflux.vitals.infrastructure.history.adapter;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Repository;

import com.study.webflux.vitals.domain.history.model.HistoricalDataPoint;
import com.study.webflux.vitals.domain.history.model.PointKey;
import com.study.webflux.vitals.domain.history.model.ProjectId;
import com.study.webflux.vitals.domain.history.model.RenderingStrategy;
import com.study.webflux.vitals.domain.history.port.HistoricalDataPointRepository;
import com.study.webflux.vitals.domain.history.port.KeyValueStorePort;
import com.study.webflux.vitals.domain.history.service.HistoricalKeyCodec;
import com.study.webflux.vitals.infrastructure.history.serialization.HistoricalDataPointJsonCodec;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** 키-값 저장소 위에서 데이터 포인트를 저장하고 키 패턴으로 탐색하는 저장소 구현입니다. */
@Repository
@RequiredArgsConstructor
public class KeyValueHistoricalDataPointRepository implements HistoricalDataPointRepository {

	private final KeyValueStorePort keyValueStore;
	private final HistoricalDataPointJsonCodec codec;

	@Override
	public Mono<Boolean> save(HistoricalDataPoint point, Duration ttl) {
		return Mono.fromCallable(() -> codec.encode(point))
			.flatMap(json -> keyValueStore.set(
				HistoricalKeyCodec.pointKey(point.strategy(), point.projectId(), point.timestamp()),
				json,
				ttl));
	}

	@Override
	public Mono<List<HistoricalDataPoint>> findAllByStrategies(List<RenderingStrategy> strategies,
		ProjectId projectId) {
		return Flux.fromIterable(strategies)
			.concatMap(strategy -> findKeys(HistoricalKeyCodec.pointPattern(strategy, projectId),
				strategy,
				projectId))
			.collectList()
			.flatMap(this::fetchAll);
	}

	@Override
	public Mono<List<HistoricalDataPoint>> findAllByDay(RenderingStrategy strategy,
		ProjectId projectId,
		Instant date) {
		return findKeys(HistoricalKeyCodec.dayPattern(strategy, projectId, date), strategy, projectId)
			.collectList()
			.flatMap(this::fetchAll);
	}

	/** 패턴이 다른 프로젝트나 집계 키까지 잡을 수 있으므로 키를 해석해 한 번 더 거릅니다. */
	private Flux<String> findKeys(String pattern, RenderingStrategy strategy, ProjectId projectId) {
		return keyValueStore.listKeys(pattern)
			.filter(key -> HistoricalKeyCodec.parsePointKey(key)
				.filter(parsed -> isOwnedBy(parsed, strategy, projectId))
				.isPresent());
	}

	private Mono<List<HistoricalDataPoint>> fetchAll(List<String> keys) {
		if (keys.isEmpty()) {
			return Mono.just(List.of());
		}
		return keyValueStore.multiGet(keys)
			.map(values -> values.stream()
				.filter(Objects::nonNull)
				.map(codec::decode)
				.toList());
	}

	private static boolean isOwnedBy(PointKey key, RenderingStrategy strategy, ProjectId projectId) {
		return key.strategy() == strategy && key.projectId().equals(projectId);
	}
}

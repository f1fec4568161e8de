package com.study.webflux.vitals.infrastructure.history.adapter;

import java.time.Duration;
import java.util.List;

import lombok.RequiredArgsConstructor;

import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;

import com.study.webflux.vitals.domain.history.exception.HistoricalStoreException;
import com.study.webflux.vitals.domain.history.exception.StoreOperation;
import com.study.webflux.vitals.domain.history.port.KeyValueStorePort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** Redis를 키-값 저장소로 사용하는 어댑터입니다. */
@Component
@RequiredArgsConstructor
public class RedisKeyValueStoreAdapter implements KeyValueStorePort {

	private static final long SCAN_BATCH_SIZE = 500;

	private final ReactiveStringRedisTemplate redisTemplate;

	@Override
	public Mono<Boolean> set(String key, String value, Duration ttl) {
		return redisTemplate.opsForValue()
			.set(key, value, ttl)
			.onErrorMap(error -> new HistoricalStoreException(StoreOperation.SET,
				"Redis SET 실패: " + key,
				error));
	}

	@Override
	public Mono<String> get(String key) {
		return redisTemplate.opsForValue()
			.get(key)
			.onErrorMap(error -> new HistoricalStoreException(StoreOperation.READ,
				"Redis GET 실패: " + key,
				error));
	}

	/** KEYS 대신 SCAN으로 키를 순회합니다. */
	@Override
	public Flux<String> listKeys(String pattern) {
		ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH_SIZE).build();
		return redisTemplate.scan(options)
			.onErrorMap(error -> new HistoricalStoreException(StoreOperation.LIST_KEYS,
				"Redis SCAN 실패: " + pattern,
				error));
	}

	@Override
	public Mono<List<String>> multiGet(List<String> keys) {
		if (keys.isEmpty()) {
			return Mono.just(List.of());
		}
		return redisTemplate.opsForValue()
			.multiGet(keys)
			.onErrorMap(error -> new HistoricalStoreException(StoreOperation.MULTI_GET,
				"Redis MGET 실패: keys=" + keys.size(),
				error));
	}
}

package com.study.webflux.vitals.domain.history.port;

import java.time.Duration;
import java.util.List;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 이력 저장에 사용하는 키-값 저장소 계약입니다.
 *
 * <p>
 * 구현체는 실패를 {@link com.study.webflux.vitals.domain.history.exception.HistoricalStoreException} 오류 신호로 전달해야 합니다.
 */
public interface KeyValueStorePort {

	/** 만료 시간과 함께 값을 기록합니다. 마지막 기록이 이전 값을 덮어씁니다. */
	Mono<Boolean> set(String key, String value, Duration ttl);

	/** 값을 조회합니다. 키가 없으면 빈 Mono를 반환합니다. */
	Mono<String> get(String key);

	/** glob 패턴과 일치하는 키를 나열합니다. */
	Flux<String> listKeys(String pattern);

	/**
	 * 여러 키를 한 번의 호출로 조회합니다.
	 *
	 * @return 입력과 같은 순서, 같은 길이의 목록. 없는 키 위치에는 null이 들어갑니다.
	 */
	Mono<List<String>> multiGet(List<String> keys);
}

package com.study.webflux.vitals.infrastructure.history.adapter;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.data.redis.core.ScanOptions;

import com.study.webflux.vitals.domain.history.exception.HistoricalStoreException;
import com.study.webflux.vitals.domain.history.exception.StoreOperation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisKeyValueStoreAdapterTest {

	private static final String KEY = "historical:default:ssr:2024-01-01:1704103200000";
	private static final Duration TTL = Duration.ofDays(90);

	@Mock
	private ReactiveStringRedisTemplate redisTemplate;

	@Mock
	private ReactiveValueOperations<String, String> valueOps;

	private RedisKeyValueStoreAdapter adapter;

	@BeforeEach
	void setUp() {
		adapter = new RedisKeyValueStoreAdapter(redisTemplate);
	}

	@Test
	@DisplayName("값 저장 시 만료 시간과 함께 SET 명령 실행")
	void set_withTtl() {
		when(redisTemplate.opsForValue()).thenReturn(valueOps);
		when(valueOps.set(KEY, "{}", TTL)).thenReturn(Mono.just(true));

		StepVerifier.create(adapter.set(KEY, "{}", TTL)).expectNext(true).verifyComplete();

		verify(valueOps).set(KEY, "{}", TTL);
	}

	@Test
	@DisplayName("저장 실패 시 SET 작업으로 감싼 예외 전파")
	void set_error_wrapped() {
		when(redisTemplate.opsForValue()).thenReturn(valueOps);
		when(valueOps.set(anyString(), anyString(), any(Duration.class))).thenReturn(
			Mono.error(new RuntimeException("Redis connection error")));

		StepVerifier.create(adapter.set(KEY, "{}", TTL))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(HistoricalStoreException.class)
					.hasRootCauseMessage("Redis connection error");
				assertThat(((HistoricalStoreException) error).getOperation())
					.isEqualTo(StoreOperation.SET);
			})
			.verify();
	}

	@Test
	@DisplayName("값이 없으면 빈 Mono 반환")
	void get_notExists_returnsEmpty() {
		when(redisTemplate.opsForValue()).thenReturn(valueOps);
		when(valueOps.get(KEY)).thenReturn(Mono.empty());

		StepVerifier.create(adapter.get(KEY)).verifyComplete();
	}

	@Test
	@DisplayName("키 나열은 SCAN MATCH 패턴을 사용")
	void listKeys_usesScanWithPattern() {
		String pattern = "historical:default:ssr:*";
		when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(Flux.just(KEY));

		StepVerifier.create(adapter.listKeys(pattern)).expectNext(KEY).verifyComplete();

		ArgumentCaptor<ScanOptions> captor = ArgumentCaptor.forClass(ScanOptions.class);
		verify(redisTemplate).scan(captor.capture());
		assertThat(captor.getValue().getPattern()).isEqualTo(pattern);
	}

	@Test
	@DisplayName("키 나열 실패 시 LIST_KEYS 작업으로 감싼 예외 전파")
	void listKeys_error_wrapped() {
		when(redisTemplate.scan(any(ScanOptions.class))).thenReturn(
			Flux.error(new RuntimeException("Redis timeout")));

		StepVerifier.create(adapter.listKeys("historical:*"))
			.expectErrorMatches(error -> error instanceof HistoricalStoreException storeException
				&& storeException.getOperation() == StoreOperation.LIST_KEYS)
			.verify();
	}

	@Test
	@DisplayName("여러 키를 한 번의 MGET으로 조회하고 없는 키는 null로 유지")
	void multiGet_preservesOrderAndNulls() {
		List<String> keys = List.of("a", "b", "c");
		when(redisTemplate.opsForValue()).thenReturn(valueOps);
		when(valueOps.multiGet(keys)).thenReturn(Mono.just(Arrays.asList("1", null, "3")));

		StepVerifier.create(adapter.multiGet(keys))
			.assertNext(values -> assertThat(values).containsExactly("1", null, "3"))
			.verifyComplete();
	}

	@Test
	@DisplayName("빈 키 목록은 Redis를 호출하지 않는다")
	void multiGet_emptyKeys_skipsRedis() {
		StepVerifier.create(adapter.multiGet(List.of()))
			.assertNext(values -> assertThat(values).isEmpty())
			.verifyComplete();

		verifyNoInteractions(redisTemplate);
	}

	@Test
	@DisplayName("일괄 조회 실패 시 MULTI_GET 작업으로 감싼 예외 전파")
	void multiGet_error_wrapped() {
		when(redisTemplate.opsForValue()).thenReturn(valueOps);
		when(valueOps.multiGet(anyList())).thenReturn(
			Mono.error(new RuntimeException("Redis timeout")));

		StepVerifier.create(adapter.multiGet(List.of("a")))
			.expectErrorMatches(error -> error instanceof HistoricalStoreException storeException
				&& storeException.getOperation() == StoreOperation.MULTI_GET)
			.verify();
	}
}

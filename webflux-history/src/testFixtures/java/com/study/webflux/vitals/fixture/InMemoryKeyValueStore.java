package com.study.webflux.vitals.fixture;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

import com.study.webflux.vitals.domain.history.port.KeyValueStorePort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** Redis glob 규칙(*, ?, [..], 역슬래시 이스케이프)을 흉내 내는 테스트용 저장소입니다. */
public class InMemoryKeyValueStore implements KeyValueStorePort {

	private final Map<String, String> values = new ConcurrentHashMap<>();
	private final Map<String, Duration> ttls = new ConcurrentHashMap<>();
	private final AtomicInteger listKeysCalls = new AtomicInteger();
	private final AtomicInteger multiGetCalls = new AtomicInteger();

	@Override
	public Mono<Boolean> set(String key, String value, Duration ttl) {
		return Mono.fromCallable(() -> {
			values.put(key, value);
			ttls.put(key, ttl);
			return true;
		});
	}

	@Override
	public Mono<String> get(String key) {
		return Mono.justOrEmpty(values.get(key));
	}

	@Override
	public Flux<String> listKeys(String pattern) {
		return Flux.defer(() -> {
			listKeysCalls.incrementAndGet();
			Pattern regex = globToRegex(pattern);
			return Flux.fromIterable(new ArrayList<>(values.keySet()))
				.filter(key -> regex.matcher(key).matches());
		});
	}

	@Override
	public Mono<List<String>> multiGet(List<String> keys) {
		return Mono.fromCallable(() -> {
			multiGetCalls.incrementAndGet();
			List<String> result = new ArrayList<>(keys.size());
			for (String key : keys) {
				result.add(values.get(key));
			}
			return result;
		});
	}

	public void put(String key, String value) {
		values.put(key, value);
	}

	public void remove(String key) {
		values.remove(key);
	}

	public Map<String, String> values() {
		return values;
	}

	public Duration ttlOf(String key) {
		return ttls.get(key);
	}

	public int listKeysCalls() {
		return listKeysCalls.get();
	}

	public int multiGetCalls() {
		return multiGetCalls.get();
	}

	static Pattern globToRegex(String glob) {
		StringBuilder regex = new StringBuilder();
		boolean inClass = false;
		for (int i = 0; i < glob.length(); i++) {
			char c = glob.charAt(i);
			if (c == '\\' && i + 1 < glob.length()) {
				regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
			} else if (inClass) {
				if (c == ']') {
					inClass = false;
				}
				regex.append(c);
			} else if (c == '*') {
				regex.append(".*");
			} else if (c == '?') {
				regex.append('.');
			} else if (c == '[') {
				inClass = true;
				regex.append(c);
			} else {
				regex.append(Pattern.quote(String.valueOf(c)));
			}
		}
		return Pattern.compile(regex.toString(), Pattern.DOTALL);
	}
}

package com.study.webflux.vitals.infrastructure.monitoring.config;

import org.springframework.stereotype.Component;

import com.study.webflux.vitals.domain.history.exception.StoreOperation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * 성능 이력 저장소 메트릭을 제공합니다.
 *
 * <p>
 * 공개 연산은 실패를 호출자에게 알리지 않으므로, 실패 여부는 로그와 이 카운터로만 확인할 수 있습니다.
 */
@Component
public class HistoricalStoreMetricsConfiguration {

	private final MeterRegistry meterRegistry;

	private final Counter savedCounter;
	private final DistributionSummary queriedPoints;

	public HistoricalStoreMetricsConfiguration(MeterRegistry meterRegistry) {
		this.meterRegistry = meterRegistry;

		this.savedCounter = Counter.builder("historical.store.saved")
			.description("Number of persisted historical data points")
			.register(meterRegistry);

		this.queriedPoints = DistributionSummary.builder("historical.query.points")
			.description("Number of data points returned by a range query")
			.publishPercentiles(0.5, 0.9, 0.99)
			.register(meterRegistry);
	}

	public void recordSaved() {
		savedCounter.increment();
	}

	/** 연산별 실패를 기록합니다. */
	public void recordFailure(StoreOperation operation) {
		Counter.builder("historical.store.failure")
			.tag("operation", operation.tagValue())
			.description("Number of historical store operations that fell back to a sentinel")
			.register(meterRegistry)
			.increment();
	}

	public void recordQueriedPoints(int count) {
		queriedPoints.record(count);
	}
}

package com.study.webflux.vitals.infrastructure.history.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** 성능 이력 저장소 설정을 제공합니다. */
@Configuration
@EnableConfigurationProperties(HistoricalStorageProperties.class)
public class HistoricalStorageConfiguration {

	/** 측정 시각 기본값과 회귀 감지 구간 계산에 사용하는 UTC 시계입니다. */
	@Bean
	@ConditionalOnMissingBean
	public Clock clock() {
		return Clock.systemUTC();
	}

	/** 저장 설정을 생성합니다. */
	@Bean
	public HistoricalStoreConfig historicalStoreConfig(HistoricalStorageProperties properties) {
		return new HistoricalStoreConfig(properties.getRetention());
	}

	/** 회귀 감지 설정을 생성합니다. */
	@Bean
	public RegressionDetectionConfig regressionDetectionConfig(
		HistoricalStorageProperties properties) {
		var regression = properties.getRegression();
		return new RegressionDetectionConfig(regression.getWindow(),
			regression.getThreshold(),
			regression.getSplitMode());
	}
}

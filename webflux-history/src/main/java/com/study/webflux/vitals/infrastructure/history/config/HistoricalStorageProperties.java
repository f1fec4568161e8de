package com.study.webflux.vitals.infrastructure.history.config;

import java.time.Duration;

import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import com.study.webflux.vitals.domain.history.model.RegressionSplitMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/** 성능 이력 저장 및 회귀 감지 설정입니다. */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "historical")
public class HistoricalStorageProperties {

	/** 데이터 포인트 보관 기간. 저장소 만료 시간으로 적용됩니다. */
	@NotNull
	private Duration retention = Duration.ofDays(90);

	@Valid
	private Regression regression = new Regression();

	@Getter
	@Setter
	public static class Regression {

		/** 현재 시각부터 거슬러 올라가는 분석 구간 */
		@NotNull
		private Duration window = Duration.ofDays(7);

		/** 기본 악화 임계값 (0.2 = 20%) */
		@PositiveOrZero
		private double threshold = 0.2;

		@NotNull
		private RegressionSplitMode splitMode = RegressionSplitMode.POSITIONAL;
	}
}

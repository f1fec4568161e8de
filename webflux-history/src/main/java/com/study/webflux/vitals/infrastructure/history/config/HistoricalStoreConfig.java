package com.study.webflux.vitals.infrastructure.history.config;

import java.time.Duration;

public record HistoricalStoreConfig(
	Duration retention
) {
}

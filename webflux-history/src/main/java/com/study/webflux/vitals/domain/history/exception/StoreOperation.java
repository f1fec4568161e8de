package com.study.webflux.vitals.domain.history.exception;

import java.util.Locale;

/** 실패 로그와 메트릭 태그에 사용하는 저장소 작업 구분입니다. */
public enum StoreOperation {
	SAVE,
	GET,
	QUERY,
	AGGREGATE,
	DETECT_REGRESSIONS,

	SET,
	READ,
	LIST_KEYS,
	MULTI_GET,
	SERIALIZE,
	DESERIALIZE;

	public String tagValue() {
		return name().toLowerCase(Locale.ROOT).replace('_', '-');
	}
}

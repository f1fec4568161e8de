package com.study.webflux.vitals.domain.history.model;

import java.util.Locale;

/** 측정 대상 페이지의 렌더링 전략입니다. */
public enum RenderingStrategy {
	/** 요청마다 서버에서 렌더링합니다. */
	SSR,

	/** 빌드 시점에 정적으로 생성합니다. */
	SSG,

	/** 정적 생성 후 주기적으로 재검증합니다. */
	ISR,

	/** 컴포넌트 단위 캐시를 사용합니다. */
	CACHE;

	/** 저장소 키에 들어가는 소문자 표기를 반환합니다. */
	public String keySegment() {
		return name().toLowerCase(Locale.ROOT);
	}
}

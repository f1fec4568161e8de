package com.study.webflux.vitals.domain.history.model;

/** 회귀 감지 시 기준/현재 구간을 나누는 방식입니다. */
public enum RegressionSplitMode {
	/** 시간순 결과 목록을 인덱스 중간에서 나눕니다. */
	POSITIONAL,

	/** 조회 구간의 시간 중간점을 기준으로 나눕니다. */
	CALENDAR
}

package com.study.webflux.vitals.domain.history.exception;

/**
 * 키-값 저장소 호출 또는 직렬화 과정에서 발생한 오류입니다.
 *
 * <p>
 * 어댑터 경계에서 원인 예외를 감싸 Reactor 오류 신호로 전달하며, 공개 연산에서 센티널 값으로 변환됩니다.
 */
public class HistoricalStoreException extends RuntimeException {

	private final StoreOperation operation;

	public HistoricalStoreException(StoreOperation operation, String message, Throwable cause) {
		super(message, cause);
		this.operation = operation;
	}

	public HistoricalStoreException(StoreOperation operation, String message) {
		super(message);
		this.operation = operation;
	}

	public StoreOperation getOperation() {
		return operation;
	}
}

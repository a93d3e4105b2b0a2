package com.metaextract.core.error;

/** 추출 파이프라인 예외의 공통 상위 타입 (unchecked). */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}

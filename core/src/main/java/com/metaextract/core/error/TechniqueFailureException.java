package com.metaextract.core.error;

/**
 * 기법 내부의 복구 불가 오류.
 * 파이프라인은 이 예외를 잡지 않는다. "값 없음"은 실패가 아니라 빈 목록으로 표현할 것.
 */
public class TechniqueFailureException extends ExtractionException {

    private final String technique;

    public TechniqueFailureException(String technique, String message) {
        this(technique, message, null);
    }

    public TechniqueFailureException(String technique, String message, Throwable cause) {
        super("[" + technique + "] " + message, cause);
        this.technique = technique;
    }

    public String getTechnique() {
        return technique;
    }
}

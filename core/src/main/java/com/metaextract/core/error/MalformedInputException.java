package com.metaextract.core.error;

/** 입력 오류: 빈 마크업, 파싱 불가 마크업, 절대 URI가 아닌 source URL. */
public class MalformedInputException extends ExtractionException {

    public MalformedInputException(String message) {
        super(message);
    }

    public MalformedInputException(String message, Throwable cause) {
        super(message, cause);
    }
}

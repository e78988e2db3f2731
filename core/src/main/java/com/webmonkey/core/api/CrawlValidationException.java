package com.webmonkey.core.api;

/**
 * 탐색 시작 전에 거부되는 입력 오류(잘못된 seed, 패턴, 출력 형식 등).
 * 어떤 설정 항목이 문제인지 {@link #getField()} 로 알려준다. 재시도 대상 아님.
 */
public class CrawlValidationException extends IllegalArgumentException {
    private final String field;

    public CrawlValidationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public CrawlValidationException(String field, String message, Throwable cause) {
        super(field + ": " + message, cause);
        this.field = field;
    }

    public String getField() { return field; }
}

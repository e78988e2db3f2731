package com.webmonkey.core.driver;

/**
 * 드라이버 경계의 실패. 보통은 해당 동작/URL 만 실패로 기록하고 계속한다.
 * fatal=true 면 세션 자체가 죽은 것이므로 남은 액션을 중단한다.
 */
public class DriverException extends RuntimeException {
    private final boolean fatal;

    public DriverException(String message) { this(message, null, false); }

    public DriverException(String message, Throwable cause) { this(message, cause, false); }

    public DriverException(String message, Throwable cause, boolean fatal) {
        super(message, cause);
        this.fatal = fatal;
    }

    public static DriverException fatal(String message, Throwable cause) {
        return new DriverException(message, cause, true);
    }

    public boolean isFatal() { return fatal; }
}

package com.webmonkey.core.driver;

/**
 * 외부 브라우저 자동화 드라이버 경계.
 * 한 인스턴스 = 탐색 가능한 세션 하나이며, 동시에 한 스레드만 사용한다.
 * 모든 실패는 {@link DriverException} (요소 없음은 {@link ElementNotFoundException}).
 */
public interface BrowserDriver extends AutoCloseable {

    void navigate(String url);

    /** 리다이렉트 반영 후 현재 URL */
    String currentUrl();

    /** 현재 DOM 직렬화 */
    String pageSource();

    /** 마지막 탐색 응답의 HTTP 상태 (모르면 -1) */
    default int lastStatus() { return -1; }

    Object executeScript(String js);

    void scrollTo(int y);

    /** 현재 뷰포트 PNG */
    byte[] captureViewport();

    /** CSS 선택자로 첫 요소. 없으면 ElementNotFoundException */
    ElementHandle findElement(String cssSelector);

    /** 포커스된 요소에 키 입력 (ENTER, TAB ...) */
    void pressKey(String key);

    @Override void close();
}

package com.webmonkey.core.driver;

/** 세션 하나를 새로 연다. 워커마다 자기 드라이버를 얻는다. */
@FunctionalInterface
public interface DriverFactory {
    BrowserDriver open();
}

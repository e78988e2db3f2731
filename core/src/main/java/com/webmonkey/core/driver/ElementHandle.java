package com.webmonkey.core.driver;

/** 드라이버가 찾은 요소 하나 */
public interface ElementHandle {
    void click();
    void clear();
    void sendKeys(String text);
}

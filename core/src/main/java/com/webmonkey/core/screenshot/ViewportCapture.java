package com.webmonkey.core.screenshot;

import java.awt.image.BufferedImage;

/**
 * 스크롤 + 뷰포트 캡처 콜백 (드라이버 쪽 책임).
 * 합성기는 scrollTo(y) → 안정화 대기 → capture(y) 순서로 호출한다.
 */
public interface ViewportCapture {

    void scrollTo(int y) throws Exception;

    /** 현재 뷰포트 이미지. y 는 방금 스크롤한 오프셋 */
    BufferedImage capture(int y) throws Exception;
}

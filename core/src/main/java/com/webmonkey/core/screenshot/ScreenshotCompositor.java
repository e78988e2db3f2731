package com.webmonkey.core.screenshot;

import com.webmonkey.core.util.Sleeper;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.Objects;

/**
 * 뷰포트 캡처를 세로로 이어붙여 전체 페이지 이미지를 만든다.
 * y = 0, vh, 2vh, ... (< totalHeight) 마다 한 번씩 캡처하고 (0, y) 에 붙인다.
 * 캔버스는 처음 측정한 totalWidth × totalHeight 고정이며 넘치는 부분은 잘린다.
 */
public final class ScreenshotCompositor {

    public static final Duration DEFAULT_SETTLE = Duration.ofMillis(500);

    private final Sleeper sleeper;
    private final Duration settle;

    public ScreenshotCompositor() {
        this(Sleeper.SYSTEM, DEFAULT_SETTLE);
    }

    public ScreenshotCompositor(Sleeper sleeper, Duration settle) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.settle = settle == null ? Duration.ZERO : settle;
    }

    public BufferedImage stitch(ViewportCapture capture, int totalHeight, int totalWidth, int viewportHeight)
            throws Exception {
        Objects.requireNonNull(capture, "capture");
        if (totalHeight <= 0 || totalWidth <= 0) {
            throw new IllegalArgumentException("page size must be positive: " + totalWidth + "x" + totalHeight);
        }
        if (viewportHeight <= 0) {
            throw new IllegalArgumentException("viewportHeight must be positive: " + viewportHeight);
        }

        BufferedImage canvas = new BufferedImage(totalWidth, totalHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            for (int y = 0; y < totalHeight; y += viewportHeight) {
                capture.scrollTo(y);
                if (!settle.isZero()) sleeper.sleep(settle);
                BufferedImage part = capture.capture(y);
                if (part != null) g.drawImage(part, 0, y, null);
            }
        } finally {
            g.dispose();
        }
        return canvas;
    }
}

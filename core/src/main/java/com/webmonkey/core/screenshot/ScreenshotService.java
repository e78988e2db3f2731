package com.webmonkey.core.screenshot;

import com.webmonkey.core.driver.BrowserDriver;
import com.webmonkey.core.driver.DriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * 드라이버를 통해 페이지 크기를 재고 뷰포트/전체 페이지 스크린샷을 만든다.
 * 전체 페이지는 이어붙인 뒤 높이를 한 번 더 재서 바뀌었으면 경고 + note 로 알린다
 * (이미지는 처음 잰 크기 그대로).
 */
public final class ScreenshotService {

    private static final Logger LOG = LoggerFactory.getLogger(ScreenshotService.class);

    static final String JS_HEIGHT = "document.body.scrollHeight";
    static final String JS_WIDTH = "document.body.scrollWidth";
    static final String JS_VIEWPORT_HEIGHT = "window.innerHeight";
    private static final Pattern NUMERIC = Pattern.compile("-?\\d+(\\.\\d+)?");

    private final ScreenshotCompositor compositor;

    public ScreenshotService(ScreenshotCompositor compositor) {
        this.compositor = Objects.requireNonNull(compositor, "compositor");
    }

    /** 현재 뷰포트 한 장 */
    public Screenshot viewport(BrowserDriver driver) throws IOException {
        byte[] png = driver.captureViewport();
        BufferedImage img = decode(png);
        return new Screenshot(png, img.getWidth(), img.getHeight(), false);
    }

    /**
     * 전체 페이지.
     * @param notes 높이 변화 등 결과에 남길 메모를 받는다
     */
    public Screenshot fullPage(BrowserDriver driver, Consumer<String> notes) throws Exception {
        int height = measure(driver, JS_HEIGHT);
        int width = measure(driver, JS_WIDTH);
        int vh = measure(driver, JS_VIEWPORT_HEIGHT);

        BufferedImage img = compositor.stitch(new DriverCapture(driver), height, width, vh);

        int after = measure(driver, JS_HEIGHT);
        if (after != height) {
            String msg = "page height changed during capture: " + height + " -> " + after
                    + " (image kept at " + height + ")";
            LOG.warn("{}: {}", driver.currentUrl(), msg);
            if (notes != null) notes.accept(msg);
        }
        return new Screenshot(encode(img), width, height, true);
    }

    public Screenshot fullPage(BrowserDriver driver) throws Exception {
        return fullPage(driver, null);
    }

    static int measure(BrowserDriver driver, String js) {
        Object v = driver.executeScript(js);
        return parseSize(v).orElseThrow(
                () -> new DriverException("could not measure page (" + js + "): " + v));
    }

    /** 스크립트 결과(숫자 또는 숫자 문자열)를 픽셀 값으로. 소수점 이하는 버린다. */
    static OptionalInt parseSize(Object v) {
        if (v instanceof Number) return OptionalInt.of(((Number) v).intValue());
        if (v == null) return OptionalInt.empty();
        String s = v.toString().trim();
        if (!NUMERIC.matcher(s).matches()) return OptionalInt.empty();
        return OptionalInt.of((int) Double.parseDouble(s));
    }

    static BufferedImage decode(byte[] png) throws IOException {
        BufferedImage img = ImageIO.read(new ByteArrayInputStream(png));
        if (img == null) throw new IOException("driver returned an unreadable image");
        return img;
    }

    static byte[] encode(BufferedImage img) throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        if (!ImageIO.write(img, "png", bos)) throw new IOException("no PNG writer available");
        return bos.toByteArray();
    }

    /** 드라이버 스크롤/캡처를 합성기 콜백으로 */
    private static final class DriverCapture implements ViewportCapture {
        private final BrowserDriver driver;

        DriverCapture(BrowserDriver driver) { this.driver = driver; }

        @Override public void scrollTo(int y) { driver.scrollTo(y); }

        @Override public BufferedImage capture(int y) throws IOException {
            return decode(driver.captureViewport());
        }
    }
}

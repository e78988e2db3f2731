package com.webmonkey.core.screenshot;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Base64;

/** 인코딩된 PNG 한 장. JSON 에는 base64 로 나간다. */
public final class Screenshot {
    private final byte[] png;
    private final int width;
    private final int height;
    private final boolean fullPage;

    public Screenshot(byte[] png, int width, int height, boolean fullPage) {
        this.png = png.clone();
        this.width = width;
        this.height = height;
        this.fullPage = fullPage;
    }

    @JsonIgnore public byte[] getPng() { return png.clone(); }
    @JsonProperty("base64")    public String getBase64() { return Base64.getEncoder().encodeToString(png); }
    @JsonProperty("width")     public int getWidth() { return width; }
    @JsonProperty("height")    public int getHeight() { return height; }
    @JsonProperty("full_page") public boolean isFullPage() { return fullPage; }

    @Override public String toString() {
        return "Screenshot{" + width + "x" + height + (fullPage ? ", fullPage" : "") + ", " + png.length + " bytes}";
    }
}

package io.switchboard.core.model;

import java.util.Base64;

/**
 * Image attached to a request, either inline bytes or a URL the backend (or adapter) can fetch.
 */
public record ImageInput(byte[] data, String mimeType, String url) {

    public ImageInput {
        mimeType = mimeType == null || mimeType.isBlank() ? "image/png" : mimeType;
        url = url == null ? "" : url.trim();
        if ((data == null || data.length == 0) && url.isEmpty()) {
            throw new IllegalArgumentException("image requires inline data or a url");
        }
    }

    public static ImageInput inline(byte[] data, String mimeType) {
        return new ImageInput(data, mimeType, null);
    }

    public static ImageInput ofUrl(String url) {
        return new ImageInput(null, null, url);
    }

    public boolean hasInlineData() {
        return data != null && data.length > 0;
    }

    public String base64() {
        return hasInlineData() ? Base64.getEncoder().encodeToString(data) : "";
    }

    public String dataUrl() {
        return "data:" + mimeType + ";base64," + base64();
    }
}

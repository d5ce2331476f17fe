package com.lux032.maestro.image;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 编码后的图片数据
 */
@Getter
@EqualsAndHashCode
public final class Image {

    private final byte[] data;
    private final ImageFormat format;

    public Image(byte[] data, ImageFormat format) {
        this.data = data;
        this.format = format;
    }

    public static Image png(byte[] data) {
        return new Image(data, ImageFormat.PNG);
    }

    public static Image jpeg(byte[] data) {
        return new Image(data, ImageFormat.JPEG);
    }

    public String getMimeType() {
        return format.mimeType();
    }

    @Override
    public String toString() {
        return String.format("Image{format=%s, size=%d KB}", format, data.length / 1024);
    }
}

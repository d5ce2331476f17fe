package com.lux032.maestro.image;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * 将原始图片转换为缓存/嵌入用的封面
 */
@FunctionalInterface
public interface CoverTransform {

    Image apply(BufferedImage source) throws IOException;

    /**
     * 标准封面: 缩放到 size x size 方框内, 分别编码为 PNG 和 JPEG, 取较小者
     */
    static CoverTransform standard(ImageCodec codec, int size) {
        return source -> {
            BufferedImage resized = codec.resize(source, size, size);
            byte[] png = codec.encode(resized, ImageFormat.PNG);
            byte[] jpeg = codec.encode(resized, ImageFormat.JPEG);
            return png.length <= jpeg.length ? Image.png(png) : Image.jpeg(jpeg);
        };
    }

    /**
     * 车载封面: 缩放到 size x size 方框内, 固定编码为 JPEG
     */
    static CoverTransform carSafe(ImageCodec codec, int size) {
        return source -> Image.jpeg(codec.encode(codec.resize(source, size, size), ImageFormat.JPEG));
    }
}

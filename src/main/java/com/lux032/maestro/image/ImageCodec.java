package com.lux032.maestro.image;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * 图片编解码器
 */
public interface ImageCodec {

    /**
     * 解码 PNG/JPEG 数据
     */
    BufferedImage decode(byte[] data) throws IOException;

    /**
     * 保持宽高比缩放, 使图片恰好放入 width x height 的方框 (可放大也可缩小)
     */
    BufferedImage resize(BufferedImage image, int width, int height);

    /**
     * 编码为指定格式
     */
    byte[] encode(BufferedImage image, ImageFormat format) throws IOException;
}

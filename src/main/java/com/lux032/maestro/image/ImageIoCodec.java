package com.lux032.maestro.image;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;

/**
 * 基于 ImageIO 的编解码器
 */
@Slf4j
public class ImageIoCodec implements ImageCodec {

    private final float jpegQuality;

    public ImageIoCodec(float jpegQuality) {
        this.jpegQuality = jpegQuality;
    }

    @Override
    public BufferedImage decode(byte[] data) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(data));
        if (image == null) {
            throw new IOException("无法识别的图片格式");
        }
        log.debug("解码图片: {}x{}", image.getWidth(), image.getHeight());
        return image;
    }

    @Override
    public BufferedImage resize(BufferedImage original, int width, int height) {
        int originalWidth = original.getWidth();
        int originalHeight = original.getHeight();

        // 计算缩放比例(保持宽高比)
        double scale = Math.min((double) width / originalWidth, (double) height / originalHeight);
        int scaledWidth = Math.max(1, (int) Math.round(originalWidth * scale));
        int scaledHeight = Math.max(1, (int) Math.round(originalHeight * scale));

        BufferedImage scaled = new BufferedImage(scaledWidth, scaledHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2d = scaled.createGraphics();
        try {
            g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
            g2d.drawImage(original, 0, 0, scaledWidth, scaledHeight, null);
        } finally {
            g2d.dispose();
        }

        log.debug("缩放图片: {}x{} -> {}x{}", originalWidth, originalHeight, scaledWidth, scaledHeight);
        return scaled;
    }

    @Override
    public byte[] encode(BufferedImage image, ImageFormat format) throws IOException {
        switch (format) {
            case PNG:
                return encodePng(image);
            case JPEG:
                return encodeJpeg(image);
            default:
                throw new IOException("不支持的图片格式: " + format);
        }
    }

    private byte[] encodePng(BufferedImage image) throws IOException {
        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        if (!ImageIO.write(toRgb(image), "png", baos)) {
            throw new IOException("没有可用的PNG写入器");
        }
        return baos.toByteArray();
    }

    /**
     * 将图片压缩为JPEG格式
     */
    private byte[] encodeJpeg(BufferedImage image) throws IOException {
        // JPEG不支持透明度
        BufferedImage rgbImage = toRgb(image);

        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpg");
        if (!writers.hasNext()) {
            throw new IOException("没有可用的JPEG写入器");
        }

        ImageWriter writer = writers.next();
        ImageWriteParam writeParam = writer.getDefaultWriteParam();
        writeParam.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        writeParam.setCompressionQuality(jpegQuality);

        ByteArrayOutputStream baos = new ByteArrayOutputStream();
        try (ImageOutputStream ios = ImageIO.createImageOutputStream(baos)) {
            writer.setOutput(ios);
            writer.write(null, new IIOImage(rgbImage, null, null), writeParam);
        } finally {
            writer.dispose();
        }

        return baos.toByteArray();
    }

    private static BufferedImage toRgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_RGB) {
            return image;
        }
        BufferedImage rgbImage = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgbImage.createGraphics();
        g.drawImage(image, 0, 0, null);
        g.dispose();
        return rgbImage;
    }
}

package com.lux032.maestro.image;

/**
 * 封面图片格式
 */
public enum ImageFormat {
    PNG("png", "image/png"),
    JPEG("jpg", "image/jpeg");

    private final String extension;
    private final String mimeType;

    ImageFormat(String extension, String mimeType) {
        this.extension = extension;
        this.mimeType = mimeType;
    }

    /**
     * 写入缓存时使用的扩展名
     */
    public String extension() {
        return extension;
    }

    public String mimeType() {
        return mimeType;
    }

    /**
     * 根据文件头识别格式
     *
     * @return 识别出的格式, 不是 PNG 或 JPEG 时返回 null
     */
    public static ImageFormat detect(byte[] data) {
        if (data.length >= 8
            && (data[0] & 0xFF) == 0x89 && data[1] == 'P' && data[2] == 'N' && data[3] == 'G'
            && data[4] == 0x0D && data[5] == 0x0A && data[6] == 0x1A && data[7] == 0x0A) {
            return PNG;
        }
        if (data.length >= 3
            && (data[0] & 0xFF) == 0xFF && (data[1] & 0xFF) == 0xD8 && (data[2] & 0xFF) == 0xFF) {
            return JPEG;
        }
        return null;
    }

    /**
     * 检查数据是否以该格式的结束标记收尾 (PNG 的 IEND 块, JPEG 的 EOI)
     * 用于识别写入中断后残留的不完整文件
     */
    public boolean isComplete(byte[] data) {
        int n = data.length;
        if (this == PNG) {
            return n >= 20
                && data[n - 8] == 'I' && data[n - 7] == 'E' && data[n - 6] == 'N' && data[n - 5] == 'D'
                && (data[n - 4] & 0xFF) == 0xAE && (data[n - 3] & 0xFF) == 0x42
                && (data[n - 2] & 0xFF) == 0x60 && (data[n - 1] & 0xFF) == 0x82;
        }
        return n >= 4 && (data[n - 2] & 0xFF) == 0xFF && (data[n - 1] & 0xFF) == 0xD9;
    }
}

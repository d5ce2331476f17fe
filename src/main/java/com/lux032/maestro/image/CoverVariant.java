package com.lux032.maestro.image;

/**
 * 封面变体
 * 两种变体的查找流程相同, 只是转换方式和缓存子目录不同
 */
public enum CoverVariant {
    /** 标准封面, 写入完整标签 */
    STANDARD("covers"),
    /** 车载封面, 尺寸更小, 固定为 JPEG */
    CAR_SAFE("covers-vw");

    private final String cacheDirectoryName;

    CoverVariant(String cacheDirectoryName) {
        this.cacheDirectoryName = cacheDirectoryName;
    }

    /**
     * extras/.cache 下的子目录名
     */
    public String cacheDirectoryName() {
        return cacheDirectoryName;
    }
}

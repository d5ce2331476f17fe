package com.lux032.maestro.image;

import lombok.Getter;

import java.nio.file.Path;

/**
 * 封面解析失败
 * 注意: "没有封面" 不是错误, 用空的 Optional 表示
 */
@Getter
public class CoverException extends Exception {

    public enum Reason {
        /** 读取缓存文件失败或缓存文件格式无法识别 */
        CACHE_READ,
        /** 读取原始图片失败 */
        SOURCE_READ,
        /** 原始图片无法解码 */
        DECODE,
        /** 缩放或重新编码失败 */
        ENCODE,
        /** 无法创建缓存目录 */
        CACHE_DIRECTORY,
        /** 写入缓存文件失败 */
        CACHE_WRITE
    }

    private final Reason reason;
    private final Path path;

    public CoverException(Reason reason, Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
        this.reason = reason;
        this.path = path;
    }

    public CoverException(Reason reason, Path path, String message) {
        this(reason, path, message, null);
    }
}

package com.lux032.maestro.service;

import lombok.Getter;

import java.nio.file.Path;

/**
 * 单个曲目的操作 (写标签、导出、重命名等) 失败
 */
@Getter
public class TrackActionException extends Exception {

    // 出错的音频文件
    private final Path path;

    public TrackActionException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public TrackActionException(String message, Path path) {
        this(message, path, null);
    }
}

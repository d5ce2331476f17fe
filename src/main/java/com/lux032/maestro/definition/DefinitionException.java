package com.lux032.maestro.definition;

import lombok.Getter;

import java.nio.file.Path;

/**
 * 专辑定义读取或格式错误
 */
@Getter
public class DefinitionException extends Exception {

    // 出错的定义文件, 从字符串解析时为 null
    private final Path path;

    public DefinitionException(String message, Path path, Throwable cause) {
        super(path == null ? message : message + ": " + path, cause);
        this.path = path;
    }

    public DefinitionException(String message) {
        this(message, null, null);
    }
}

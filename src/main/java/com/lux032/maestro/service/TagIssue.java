package com.lux032.maestro.service;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 标签校验发现的单个问题
 */
@Getter
@EqualsAndHashCode
public final class TagIssue {

    public enum Kind {
        /** 应该存在但文件中没有 */
        MISSING,
        /** 文件中存在但不应该有 */
        UNEXPECTED,
        /** 两边都有但内容不同 */
        INCORRECT,
        /** 封面无法加载, 没有进行比较 */
        COVER_UNAVAILABLE
    }

    private final Kind kind;
    private final String field;
    // INCORRECT 时为文件中的实际值, COVER_UNAVAILABLE 时为错误信息
    private final String detail;

    public TagIssue(Kind kind, String field, String detail) {
        this.kind = kind;
        this.field = field;
        this.detail = detail;
    }

    public TagIssue(Kind kind, String field) {
        this(kind, field, null);
    }

    @Override
    public String toString() {
        switch (kind) {
            case MISSING:
                return "缺少 " + field;
            case UNEXPECTED:
                return "多余的 " + field;
            case INCORRECT:
                return field + " 不正确 (实际为 \"" + detail + "\")";
            default:
                return field + " 无法加载: " + detail;
        }
    }
}

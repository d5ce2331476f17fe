package com.lux032.maestro.definition;

import com.fasterxml.jackson.dataformat.yaml.util.StringQuotingChecker;

import java.util.regex.Pattern;

/**
 * 字符串引号判定
 * 在默认规则之外, 凡是按 YAML 1.1 会被解析成数字、布尔值或 null 的字符串都加引号
 * (0x1F, 1e3, 1_000, 1:20, .inf, off, ~ 等), 保证写出的定义读回来仍是文本
 */
class YamlQuotingChecker extends StringQuotingChecker {

    private static final long serialVersionUID = 1L;

    private static final Pattern INT = Pattern.compile(
        "[-+]?0b_*[0-1][0-1_]*"
            + "|[-+]?0_*[0-7][0-7_]*"
            + "|[-+]?0o[0-7_]+"
            + "|[-+]?(?:0|[1-9][0-9_]*)"
            + "|[-+]?0x_*[0-9a-fA-F][0-9a-fA-F_]*"
            + "|[-+]?[1-9][0-9_]*(?::[0-5]?[0-9])+");

    private static final Pattern FLOAT = Pattern.compile(
        "[-+]?(?:\\.[0-9_]+|[0-9][0-9_]*(?:\\.[0-9_]*)?)(?:[eE][-+]?[0-9]+)?"
            + "|[-+]?[0-9][0-9_]*(?::[0-5]?[0-9])+\\.[0-9_]*"
            + "|[-+]?\\.(?:inf|Inf|INF)"
            + "|\\.(?:nan|NaN|NAN)");

    private static final Pattern BOOL_OR_NULL = Pattern.compile(
        "y|Y|yes|Yes|YES|n|N|no|No|NO|true|True|TRUE|false|False|FALSE"
            + "|on|On|ON|off|Off|OFF|~|null|Null|NULL");

    private final StringQuotingChecker defaults = StringQuotingChecker.Default.instance();

    @Override
    public boolean needToQuoteName(String name) {
        return defaults.needToQuoteName(name);
    }

    @Override
    public boolean needToQuoteValue(String value) {
        return value.isEmpty()
            || defaults.needToQuoteValue(value)
            || resolvesToNonString(value);
    }

    static boolean resolvesToNonString(String value) {
        return INT.matcher(value).matches()
            || FLOAT.matcher(value).matches()
            || BOOL_OR_NULL.matcher(value).matches();
    }
}

package com.lux032.maestro.text;

import com.lux032.maestro.util.FileNameUtils;

/**
 * 可变的文本累加器
 * 连续拼接多个文本时复用同一组缓冲区, 结果与逐个 {@link TextValue#concat} 相同
 */
public final class TextValueBuilder {

    private final StringBuilder value = new StringBuilder();
    private final StringBuilder ascii = new StringBuilder();
    private final StringBuilder fileSafe = new StringBuilder();
    private TextValue.Ascii kind = TextValue.Ascii.SAME;

    public TextValueBuilder append(TextValue text) {
        value.append(text.value());
        ascii.append(text.ascii());
        fileSafe.append(text.fileSafe());
        kind = TextValue.Ascii.combine(kind, text.asciiKind());
        return this;
    }

    public TextValue build() {
        String builtAscii = ascii.toString();
        return new TextValue(value.toString(), kind, builtAscii, FileNameUtils.makeFileSafe(fileSafe.toString()));
    }
}

package com.lux032.maestro.text;

import com.lux032.maestro.util.FileNameUtils;
import lombok.EqualsAndHashCode;

import java.text.Normalizer;
import java.util.List;

/**
 * 文本值
 * 同时携带三种表示: 原始文本、ASCII 音译、文件名安全形式
 *
 * 不可变; 拼接 ({@link #concat(TextValue)}) 满足:
 * - 空文本是左右单位元
 * - 满足结合律
 * - 手动覆盖的 ASCII 是吸收元: 任一操作数被覆盖, 结果也被覆盖
 */
@EqualsAndHashCode
public final class TextValue {

    /**
     * ASCII 表示的来源
     */
    public enum Ascii {
        /** ASCII 与原始文本相同 */
        SAME,
        /** 由原始文本自动音译得到 */
        DERIVED,
        /** 手动覆盖 */
        OVERRIDDEN;

        static Ascii combine(Ascii left, Ascii right) {
            if (left == SAME && right == SAME) {
                return SAME;
            }
            if (left == OVERRIDDEN || right == OVERRIDDEN) {
                return OVERRIDDEN;
            }
            return DERIVED;
        }
    }

    public static final TextValue EMPTY = TextValue.of("");

    /**
     * 拼接多位艺术家时使用的分隔符
     */
    public static final TextValue COMMA_SEPARATOR = TextValue.of(", ");

    private final String value;
    private final Ascii asciiKind;
    // SAME 时为 null
    private final String ascii;
    // 与 ASCII 相同时为 null
    private final String fileSafe;

    TextValue(String value, Ascii asciiKind, String ascii, String fileSafe) {
        this.value = value;
        this.asciiKind = asciiKind;
        this.ascii = asciiKind == Ascii.SAME ? null : ascii;
        String effectiveAscii = this.ascii != null ? this.ascii : value;
        this.fileSafe = fileSafe == null || fileSafe.equals(effectiveAscii) ? null : fileSafe;
    }

    /**
     * 创建文本, 可选手动覆盖 ASCII
     * 如果覆盖值本身含有非 ASCII 字符, 覆盖值会先被音译
     *
     * @param value 原始文本
     * @param asciiOverride 手动指定的 ASCII, 可为 null
     */
    public static TextValue create(String value, String asciiOverride) {
        if (value == null) {
            throw new IllegalArgumentException("value 不能为 null");
        }

        Ascii kind;
        String ascii;
        if (asciiOverride != null) {
            kind = Ascii.OVERRIDDEN;
            String derived = transliterate(asciiOverride);
            ascii = derived != null ? derived : asciiOverride;
        } else {
            ascii = transliterate(value);
            kind = ascii == null ? Ascii.SAME : Ascii.DERIVED;
        }

        String effectiveAscii = ascii != null ? ascii : value;
        return new TextValue(value, kind, ascii, FileNameUtils.makeFileSafe(effectiveAscii));
    }

    public static TextValue of(String value) {
        return create(value, null);
    }

    public static TextValue withAscii(String value, String ascii) {
        return create(value, ascii);
    }

    /**
     * 用分隔符连接一组文本
     * 只有一个元素时直接返回该元素, 不产生新对象
     */
    public static TextValue join(List<TextValue> texts, TextValue separator) {
        if (texts.size() == 1) {
            return texts.get(0);
        }
        TextValueBuilder builder = new TextValueBuilder();
        for (int i = 0; i < texts.size(); i++) {
            if (i != 0) {
                builder.append(separator);
            }
            builder.append(texts.get(i));
        }
        return builder.build();
    }

    /**
     * 用 ", " 连接一组文本
     */
    public static TextValue commaSeparated(List<TextValue> texts) {
        return join(texts, COMMA_SEPARATOR);
    }

    public String value() {
        return value;
    }

    public String ascii() {
        return ascii != null ? ascii : value;
    }

    public String fileSafe() {
        return fileSafe != null ? fileSafe : ascii();
    }

    /**
     * 可按字母排序的文件名安全形式
     * 开头的冠词会被移到末尾, 例如 "The Title" → "Title, The"
     */
    public String sortableFileSafe() {
        String safe = fileSafe();
        String[] parts = FileNameUtils.splitArticle(safe);
        if (parts == null) {
            return safe;
        }
        return parts[1] + ", " + parts[0];
    }

    public Ascii asciiKind() {
        return asciiKind;
    }

    public boolean hasOverriddenAscii() {
        return asciiKind == Ascii.OVERRIDDEN;
    }

    public boolean isEmpty() {
        return EMPTY.equals(this);
    }

    /**
     * 拼接两个文本
     * 原始文本直接相连; ASCII 按 {@link Ascii#combine} 合并;
     * 文件名安全形式由两侧的安全形式相连后重新检查
     */
    public TextValue concat(TextValue other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }

        Ascii kind = Ascii.combine(asciiKind, other.asciiKind);
        String joinedAscii = kind == Ascii.SAME ? null : ascii().concat(other.ascii());
        String joinedFileSafe = FileNameUtils.makeFileSafe(fileSafe().concat(other.fileSafe()));
        return new TextValue(value.concat(other.value), kind, joinedAscii, joinedFileSafe);
    }

    @Override
    public String toString() {
        return value;
    }

    /**
     * 自动音译
     * 先做 Unicode 兼容分解 (NFKD), 再只保留 ASCII 字符, 少数符号有特殊替换
     *
     * @return 音译结果; 原文本已经是纯 ASCII 时返回 null
     */
    static String transliterate(String s) {
        if (isAscii(s)) {
            return null;
        }

        String decomposed = Normalizer.normalize(s, Normalizer.Form.NFKD);
        StringBuilder buf = new StringBuilder(decomposed.length());
        decomposed.codePoints().forEach(cp -> {
            if (cp < 0x80) {
                buf.append((char) cp);
                return;
            }
            char replacement = specialReplacement(cp);
            if (replacement != 0) {
                buf.append(replacement);
            }
        });
        return buf.toString();
    }

    private static char specialReplacement(int cp) {
        switch (cp) {
            case '‘':
            case '’':
                return '\'';
            case '“':
            case '”':
                return '"';
            case '¡':
                return '!';
            default:
                return 0;
        }
    }

    static boolean isAscii(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) >= 0x80) {
                return false;
            }
        }
        return true;
    }
}

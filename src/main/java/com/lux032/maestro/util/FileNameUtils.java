package com.lux032.maestro.util;

import java.util.Locale;

/**
 * 文件名工具类
 * 负责文件名安全字符替换、冠词拆分和编号位数计算
 */
public final class FileNameUtils {

    /**
     * 在一个或多个操作系统的文件名中不可用的字符
     */
    private static final String FILE_UNSAFE_CHARS = "<>:\"/|~\\*?";

    private FileNameUtils() {
    }

    /**
     * 检查字符串是否可以直接用作文件名
     */
    public static boolean isFileSafe(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (FILE_UNSAFE_CHARS.indexOf(s.charAt(i)) >= 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * 替换文件名中的非法字符
     * 映射规则:
     * - {@code <} → {@code [}, {@code >} → {@code ]}
     * - {@code :} 后跟空格时 → {@code " -"}, 否则 → {@code -}
     * - {@code "} → {@code '}
     * - {@code / | ~} → {@code -}
     * - {@code \ *} → {@code _}
     * - {@code ?} → 删除
     *
     * @param s 原始字符串
     * @return 安全的文件名; 如果原字符串已经安全, 返回同一个实例
     */
    public static String makeFileSafe(String s) {
        int first = -1;
        for (int i = 0; i < s.length(); i++) {
            if (FILE_UNSAFE_CHARS.indexOf(s.charAt(i)) >= 0) {
                first = i;
                break;
            }
        }
        if (first < 0) {
            return s;
        }

        StringBuilder buf = new StringBuilder(s.length() + 4);
        buf.append(s, 0, first);
        for (int i = first; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '<':
                    buf.append('[');
                    break;
                case '>':
                    buf.append(']');
                    break;
                case ':':
                    if (i + 1 < s.length() && s.charAt(i + 1) == ' ') {
                        buf.append(" -");
                    } else {
                        buf.append('-');
                    }
                    break;
                case '"':
                    buf.append('\'');
                    break;
                case '/':
                case '|':
                case '~':
                    buf.append('-');
                    break;
                case '\\':
                case '*':
                    buf.append('_');
                    break;
                case '?':
                    break;
                default:
                    buf.append(c);
            }
        }
        return buf.toString();
    }

    /**
     * 拆分开头的冠词 (a / an / the, 不区分大小写, 后面必须跟一个空格)
     *
     * @return 两个元素的数组 [冠词, 剩余部分], 不以冠词开头时返回 null
     */
    public static String[] splitArticle(String s) {
        int articleLength;
        if (s.regionMatches(true, 0, "the ", 0, 4)) {
            articleLength = 3;
        } else if (s.regionMatches(true, 0, "an ", 0, 3)) {
            articleLength = 2;
        } else if (s.regionMatches(true, 0, "a ", 0, 2)) {
            articleLength = 1;
        } else {
            return null;
        }
        return new String[]{s.substring(0, articleLength), s.substring(articleLength + 1)};
    }

    /**
     * 计算十进制位数, 0 视为 1 位
     */
    public static int numDigits(int number) {
        int count = 0;
        while (number != 0) {
            number /= 10;
            count++;
        }
        return Math.max(count, 1);
    }

    /**
     * 左侧补零到指定宽度, 始终输出 ASCII 数字
     */
    public static String zeroPad(int number, int width) {
        return String.format(Locale.ROOT, "%0" + width + "d", number);
    }
}

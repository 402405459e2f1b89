package com.example.identity_resolution_engine.util;

import com.example.identity_resolution_engine.model.NameParts;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * 姓名规范化工具：将原始姓名字符串转换为可比较的名/中间名/姓。
 * 纯函数、幂等，任何输入都不抛异常（null或空串返回全空结果）。
 */
public final class NameNormalizer {

    // "Last, First Middle" 形式
    private static final Pattern LAST_COMMA_FIRST = Pattern.compile("^([^,]+),\\s*(.+)$");
    private static final Pattern HONORIFICS =
            Pattern.compile("\\b(dr|prof|professor|mr|mrs|ms|sir|phd|md)\\b\\.?", Pattern.CASE_INSENSITIVE);
    private static final Pattern NON_LETTER = Pattern.compile("[^a-z\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LEADING_TITLE =
            Pattern.compile("^(dr\\.?|prof\\.?|professor)\\s+", Pattern.CASE_INSENSITIVE);

    private NameNormalizer() {
    }

    public static NameParts normalize(String raw) {
        String full = normalizeFull(raw);
        if (full.isEmpty()) {
            return NameParts.EMPTY;
        }

        String[] parts = full.split(" ");
        if (parts.length == 1) {
            // 单个词元只当作姓，不当作名
            return new NameParts("", "", parts[0], full);
        }
        if (parts.length == 2) {
            return new NameParts(parts[0], "", parts[1], full);
        }
        String middle = String.join(" ", Arrays.copyOfRange(parts, 1, parts.length - 1));
        return new NameParts(parts[0], middle, parts[parts.length - 1], full);
    }

    /**
     * 只返回规范化后的完整姓名
     */
    public static String normalizeFull(String raw) {
        if (StringUtils.isBlank(raw)) {
            return "";
        }
        String s = StringUtils.stripAccents(raw.toLowerCase());
        s = LAST_COMMA_FIRST.matcher(s.trim()).replaceFirst("$2 $1");
        s = HONORIFICS.matcher(s).replaceAll("");
        s = NON_LETTER.matcher(s).replaceAll("");
        s = WHITESPACE.matcher(s).replaceAll(" ").trim();
        // 去掉标点后可能露出新的称谓（如 "M.D." -> "md"），再清理一次保证幂等
        s = HONORIFICS.matcher(s).replaceAll("");
        return WHITESPACE.matcher(s).replaceAll(" ").trim();
    }

    /**
     * 去掉开头的 Dr./Prof./Professor，保留原大小写，用于拼装检索式
     */
    public static String stripLeadingTitle(String raw) {
        if (raw == null) {
            return "";
        }
        return LEADING_TITLE.matcher(raw.trim()).replaceFirst("").trim();
    }
}

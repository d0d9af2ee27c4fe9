package com.example.word2xml.util.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 文本处理工具类
 * 包含零宽字符清理、匹配键归一化、破折号归一化等功能
 */
public class TextUtils {

    /** 匹配键中的分隔符 */
    public static final String KEY_SEPARATOR = "|";

    /** et al / & / and 等连接词 */
    private static final Pattern CONNECTORS = Pattern.compile(
            "(?i)\\bet\\s+al\\b\\.?|&|\\band\\b");

    /** 标点和空白统一作为分隔 */
    private static final Pattern SEPARATORS = Pattern.compile("[\\s\\p{Punct}\\u2018\\u2019\\u201C\\u201D]+");

    private static final Pattern DASHES = Pattern.compile("[\\u2010\\u2011\\u2012\\u2013\\u2014]");

    /**
     * 去除零宽字符和特殊空格
     *
     * 特殊空格替换为普通空格（而不是删除），避免单词粘连
     *
     * @param text 原始文本
     * @return 清理后的文本
     */
    public static String removeZeroWidthChars(String text) {
        if (text == null) {
            return "";
        }
        return text
                .replace("\u200B", "")
                .replace("\u200C", "")
                .replace("\u200D", "")
                .replace("\uFEFF", "")
                .replace('\u00A0', ' ')
                .replace('\u2009', ' ')
                .replace('\u202F', ' ')
                .replace('\u3000', ' ');
    }

    /**
     * 破折号、连字符变体统一为 "-"
     */
    public static String normalizeDashes(String text) {
        if (text == null) {
            return "";
        }
        return DASHES.matcher(text).replaceAll("-");
    }

    /**
     * 匹配词元
     *
     * 处理步骤：
     * 1. 去除零宽字符，统一破折号
     * 2. et al、&、and 替换为分隔
     * 3. 标点和空白作为分隔，连续分隔合并
     * 4. 转换为小写
     *
     * 示例："Smith and Jones, 2020" -> [smith, jones, 2020]
     *
     * @param text 原始文本（不含标记）
     * @return 词元列表，输入为空时返回空列表
     */
    public static List<String> matchTokens(String text) {
        if (text == null || text.trim().isEmpty()) {
            return Collections.emptyList();
        }
        String cleaned = normalizeDashes(removeZeroWidthChars(text));
        cleaned = CONNECTORS.matcher(cleaned).replaceAll(" ");
        List<String> tokens = new ArrayList<>();
        for (String token : SEPARATORS.split(cleaned.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    /**
     * 归一化匹配键：词元以单个分隔符连接
     *
     * 示例："Smith &amp; Jones (2020)" -> "smith|jones|2020"
     */
    public static String matchKey(String text) {
        return String.join(KEY_SEPARATOR, matchTokens(text));
    }

    /**
     * 判断词元是否按顺序出现在文本中，且第一个词元位于文本开头
     *
     * 比较不区分大小写，词元按子串查找
     *
     * @param text   被匹配的文本（已小写）
     * @param tokens 词元（已小写）
     * @return 是否匹配
     */
    public static boolean tokensInOrder(String text, List<String> tokens) {
        if (tokens.isEmpty() || !text.startsWith(tokens.get(0))) {
            return false;
        }
        int pos = tokens.get(0).length();
        for (int i = 1; i < tokens.size(); i++) {
            int found = text.indexOf(tokens.get(i), pos);
            if (found < 0) {
                return false;
            }
            pos = found + tokens.get(i).length();
        }
        return true;
    }

    /**
     * 压缩空白：连续空白合并为一个空格，去除首尾空白
     */
    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return removeZeroWidthChars(text).replaceAll("\\s+", " ").trim();
    }

    /**
     * 截断文本显示（日志用）
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "...";
    }
}

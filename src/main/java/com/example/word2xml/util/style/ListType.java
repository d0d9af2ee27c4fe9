package com.example.word2xml.util.style;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 列表类型
 *
 * value 为输出 list-type 属性值
 */
public enum ListType {
    BULLET("bullet"),
    NUMBERED("order"),
    UPPER_ALPHA("upper-alpha"),
    LOWER_ALPHA("lower-alpha"),
    UPPER_ROMAN("upper-roman"),
    LOWER_ROMAN("lower-roman"),
    NONE("none");

    private final String value;

    ListType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** 是否有序列表（输出 label） */
    public boolean isOrdered() {
        return this != BULLET && this != NONE;
    }

    @JsonCreator
    public static ListType fromValue(String value) {
        for (ListType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的列表类型: " + value);
    }

    /**
     * Word 编号格式（w:numFmt）映射
     */
    public static ListType fromNumFormat(String numFmt) {
        if (numFmt == null) {
            return BULLET;
        }
        switch (numFmt) {
            case "decimal":
            case "decimalZero":
                return NUMBERED;
            case "lowerLetter":
                return LOWER_ALPHA;
            case "upperLetter":
                return UPPER_ALPHA;
            case "lowerRoman":
                return LOWER_ROMAN;
            case "upperRoman":
                return UPPER_ROMAN;
            case "none":
                return NONE;
            default:
                return BULLET;
        }
    }

    /**
     * 推断第 n 项（从1开始）的标签
     */
    public String label(int n) {
        switch (this) {
            case NUMBERED:
                return n + ".";
            case LOWER_ALPHA:
                return alpha(n) + ".";
            case UPPER_ALPHA:
                return alpha(n).toUpperCase() + ".";
            case LOWER_ROMAN:
                return roman(n).toLowerCase() + ".";
            case UPPER_ROMAN:
                return roman(n) + ".";
            case BULLET:
                return "•";
            default:
                return "";
        }
    }

    private static String alpha(int n) {
        StringBuilder sb = new StringBuilder();
        int v = n;
        while (v > 0) {
            v--;
            sb.insert(0, (char) ('a' + v % 26));
            v /= 26;
        }
        return sb.toString();
    }

    private static String roman(int n) {
        int[] values = {1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1};
        String[] symbols = {"M", "CM", "D", "CD", "C", "XC", "L", "XL", "X", "IX", "V", "IV", "I"};
        StringBuilder sb = new StringBuilder();
        int v = n;
        for (int i = 0; i < values.length; i++) {
            while (v >= values[i]) {
                v -= values[i];
                sb.append(symbols[i]);
            }
        }
        return sb.toString();
    }
}

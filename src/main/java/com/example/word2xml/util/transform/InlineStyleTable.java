package com.example.word2xml.util.transform;

import com.example.word2xml.util.wml.dto.FormatFlag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * 格式标记组合 -> 嵌套行内标签查找表
 *
 * 7 个格式标记共 128 种组合，启动时一次性算好，按位掩码查表。
 * 嵌套顺序（外 -> 内）：上/下标、粗体、斜体、下划线、删除线、小型大写；
 * 上标和下标同时出现时只保留上标。命名字符样式的包装标签在这些标签之外，由调用方处理
 */
public final class InlineStyleTable {

    public static final int COMBINATIONS = 1 << FormatFlag.values().length;

    private static final List<List<String>> TABLE = build();

    private InlineStyleTable() {
    }

    private static List<List<String>> build() {
        List<List<String>> table = new ArrayList<>(COMBINATIONS);
        FormatFlag[] flags = FormatFlag.values();
        for (int mask = 0; mask < COMBINATIONS; mask++) {
            List<String> tags = new ArrayList<>();
            boolean superscript = (mask & bit(FormatFlag.SUPERSCRIPT)) != 0;
            for (FormatFlag flag : flags) {
                if ((mask & bit(flag)) == 0) {
                    continue;
                }
                if (flag == FormatFlag.SUBSCRIPT && superscript) {
                    continue;
                }
                tags.add(tagName(flag));
            }
            table.add(Collections.unmodifiableList(tags));
        }
        return Collections.unmodifiableList(table);
    }

    /**
     * 标记对应的输出标签名
     */
    public static String tagName(FormatFlag flag) {
        switch (flag) {
            case SUPERSCRIPT:
                return "sup";
            case SUBSCRIPT:
                return "sub";
            case BOLD:
                return "bold";
            case ITALIC:
                return "italic";
            case UNDERLINE:
                return "underline";
            case STRIKE:
                return "strike";
            case SMALL_CAPS:
                return "sc";
            default:
                throw new IllegalArgumentException("未知格式标记: " + flag);
        }
    }

    public static int bit(FormatFlag flag) {
        return 1 << flag.ordinal();
    }

    public static int mask(Set<FormatFlag> flags) {
        int mask = 0;
        for (FormatFlag flag : flags) {
            mask |= bit(flag);
        }
        return mask;
    }

    /**
     * 查表：返回外 -> 内顺序的标签名
     */
    public static List<String> tags(int mask) {
        return TABLE.get(mask);
    }

    public static List<String> tags(Set<FormatFlag> flags) {
        return TABLE.get(mask(flags));
    }
}

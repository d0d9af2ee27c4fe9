package com.example.word2xml.util.structure;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.common.XmlUtils;
import com.example.word2xml.util.style.ParagraphRole;
import com.example.word2xml.util.transform.Markup;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 章节嵌套重建
 *
 * 算法：
 * 1. 遍历容器的直接子块（段落、列表、表格、浮动体）
 * 2. 遇到 N 级标题：弹出所有级别 >= N 的打开章节，再新建 N 级章节入栈
 * 3. 其它块：挂到栈顶章节；栈为空时留在容器中（第一个标题之前的内容）
 * 4. 文档结束时剩余章节自然闭合
 *
 * 章节栈保证输出为严格的树：子章节级别总是大于父章节
 */
@Slf4j
public class SectionNester {

    private static final class Open {
        final int level;
        final Element sec;

        Open(int level, Element sec) {
            this.level = level;
            this.sec = sec;
        }
    }

    /**
     * 重建章节嵌套
     *
     * @param container 中间标记根元素
     * @param ctx       转换上下文（章节ID计数器）
     * @return 新建的章节数
     */
    public static int nest(Element container, ConversionContext ctx) {
        Deque<Open> stack = new ArrayDeque<>();
        int created = 0;
        for (Element block : container.children()) {
            if (isHeading(block)) {
                int level = headingLevel(block);
                while (!stack.isEmpty() && stack.peek().level >= level) {
                    stack.pop();
                }
                int parentLevel = stack.isEmpty() ? 0 : stack.peek().level;
                if (level > parentLevel + 1) {
                    ctx.anomaly("标题层级跳跃: " + parentLevel + " -> " + level + " (" + block.text() + ")");
                }
                Element sec = new Element("sec")
                        .attr("id", ctx.nextSectionId(level))
                        .attr("disp-level", "level" + level);
                Element title = sec.appendElement("title");
                XmlUtils.moveChildren(block, title);
                XmlUtils.unwrapSole(title, "bold");
                if (stack.isEmpty()) {
                    block.before(sec);
                } else {
                    stack.peek().sec.appendChild(sec);
                }
                block.remove();
                stack.push(new Open(level, sec));
                created++;
            } else if (!stack.isEmpty()) {
                stack.peek().sec.appendChild(block);
            }
        }
        log.debug("[{}] 章节重建: {} 个章节", ctx.getDocumentName(), created);
        return created;
    }

    static boolean isHeading(Element block) {
        return "p".equals(block.normalName()) && ParagraphRole.HEADING.getValue().equals(block.attr(Markup.ROLE));
    }

    private static int headingLevel(Element block) {
        try {
            return Math.max(1, Math.min(6, Integer.parseInt(block.attr(Markup.LEVEL))));
        } catch (NumberFormatException e) {
            return 1;
        }
    }
}

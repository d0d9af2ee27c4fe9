package com.example.word2xml.util.structure;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.common.XmlUtils;
import com.example.word2xml.util.structure.dto.FloatBlock;
import com.example.word2xml.util.structure.dto.FloatState;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 浮动体放置
 *
 * 1. 先把所有浮动体从原位置取下
 * 2. 找到第一个引用该浮动体的块（正文或章节的直接子元素），放在它后面；
 *    同一个块后面已有浮动体时按处理顺序依次排在后面
 * 3. 只在其它浮动体内部被引用的，等那个浮动体放好后在下一轮处理
 * 4. 始终没有引用的，按原顺序放到最后一个参考文献列表之后（没有参考文献时放到正文末尾）
 */
@Slf4j
public class FloatPlacer {

    /**
     * 放置浮动体
     *
     * @param body   正文元素
     * @param floats 浮动体（原文顺序）
     * @param ctx    转换上下文
     */
    public static void place(Element body, List<FloatBlock> floats, ConversionContext ctx) {
        for (FloatBlock block : floats) {
            if (block.getElement().parent() != null) {
                block.getElement().remove();
            }
        }

        Map<Element, Element> lastAtAnchor = new IdentityHashMap<>();
        List<FloatBlock> pending = new ArrayList<>(floats);
        boolean progress = true;
        int rounds = 0;
        while (progress && !pending.isEmpty()) {
            progress = false;
            rounds++;
            Iterator<FloatBlock> it = pending.iterator();
            while (it.hasNext()) {
                FloatBlock block = it.next();
                Element anchor = findAnchor(body, block.getId());
                if (anchor == null) {
                    continue;
                }
                Element after = lastAtAnchor.containsKey(anchor) ? lastAtAnchor.get(anchor) : anchor;
                after.after(block.getElement());
                lastAtAnchor.put(anchor, block.getElement());
                block.place(FloatState.PLACED_INLINE);
                it.remove();
                progress = true;
            }
        }

        Element after = lastReferenceList(body);
        for (FloatBlock block : pending) {
            if (after == null) {
                body.appendChild(block.getElement());
            } else {
                after.after(block.getElement());
            }
            after = block.getElement();
            block.place(FloatState.APPENDED);
        }

        for (FloatBlock block : floats) {
            ctx.getReport().countFloatState(block.getState().getValue());
        }
        log.info("[{}] 浮动体放置: 共 {} 个, 随文 {} 个, 追加 {} 个, {} 轮", ctx.getDocumentName(), floats.size(),
                floats.size() - pending.size(), pending.size(), rounds);
    }

    /**
     * 第一个引用 id 的块；引用位于参考文献列表或标题内的不算
     */
    static Element findAnchor(Element body, String id) {
        for (Element ref : body.getElementsByTag("xref")) {
            if (!refersTo(ref, id) || XmlUtils.ancestor(ref, "ref-list") != null) {
                continue;
            }
            Element anchor = ref;
            while (anchor.parent() != null && anchor.parent() != body && !"sec".equals(anchor.parent().normalName())) {
                anchor = anchor.parent();
            }
            if (anchor.parent() == null || "title".equals(anchor.normalName())) {
                continue;
            }
            return anchor;
        }
        return null;
    }

    /**
     * rid 可能是以空格分隔的多个 ID（范围引用）
     */
    static boolean refersTo(Element xref, String id) {
        for (String rid : xref.attr("rid").trim().split("\\s+")) {
            if (rid.equals(id)) {
                return true;
            }
        }
        return false;
    }

    private static Element lastReferenceList(Element body) {
        List<Element> lists = body.getElementsByTag("ref-list");
        return lists.isEmpty() ? null : lists.get(lists.size() - 1);
    }
}

package com.example.word2xml.util.transform;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.common.XmlUtils;
import com.example.word2xml.util.style.ListType;
import com.example.word2xml.util.style.ParagraphRole;
import com.example.word2xml.util.style.StyleMap;
import com.example.word2xml.util.transform.dto.ReconstructedCell;
import com.example.word2xml.util.transform.dto.ReconstructedTable;
import com.example.word2xml.util.wml.dto.DocNode;
import com.example.word2xml.util.wml.dto.FormatFlag;
import com.example.word2xml.util.wml.dto.NodeType;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.nodes.XmlDeclaration;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 结构转换（流水线第二阶段）
 *
 * 把规范化树逐段、逐 run 映射为中间标记（约定见 {@link Markup}）：
 * 1. 段落按优先级确定角色：样式映射表 > 列表编号(numPr) > 大纲级别 > 普通段落
 * 2. 列表段落输出级别、类型和标签（手工输入的标签优先，否则按计数器推断）
 * 3. run 的格式标记查 {@link InlineStyleTable} 输出嵌套标签，命名字符样式在最外层
 * 4. 批注输出为成对的处理指令，超链接输出为 xref（书签）或 ext-link（外部）
 * 5. 表格交给 {@link TableReconstructor} 重建跨度后输出
 */
@Slf4j
public class StructuralTransformer {

    private static final int MAX_LEVEL = 6;

    /** 手工列表标签：制表符之前的 "1." "a)" "(iv)" "•" 等 */
    private static final Pattern MANUAL_LABEL = Pattern.compile(
            "^\\s*(\\(?(?:\\d{1,3}|[a-zA-Z]|[ivxlcdmIVXLCDM]{1,6})[.)]|[\\u2022\\u00B7\\u25AA\\u25E6\\-\\u2013*])\\s*$");

    private static final Pattern SET_TABLE = Pattern.compile("(?i)^SET\\s+Table:?\\s*(\\d+)");
    private static final Pattern HYPERLINK_LOCAL = Pattern.compile("\\\\l\\s+\"([^\"]+)\"");
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]+)\"");

    static final String BOOKMARK_REF = "bookmark";

    private final StyleMap styleMap;
    private final ConversionContext ctx;
    private final Document owner;

    /** 每级列表计数器（下标为级别） */
    private final int[] counters = new int[MAX_LEVEL + 1];
    private final ListType[] counterTypes = new ListType[MAX_LEVEL + 1];

    /** SET Table:N 声明的下一张表格列数 */
    private int pendingTableColumns = 0;

    private StructuralTransformer(StyleMap styleMap, Document owner, ConversionContext ctx) {
        this.styleMap = styleMap;
        this.owner = owner;
        this.ctx = ctx;
    }

    /**
     * 转换规范化树
     *
     * @param root     DOCUMENT 根节点
     * @param styleMap 样式映射表
     * @param owner    输出文档（中间标记根元素挂在其下）
     * @param ctx      转换上下文
     * @return 中间标记根元素 doc
     */
    public static Element transform(DocNode root, StyleMap styleMap, Document owner, ConversionContext ctx) {
        long start = System.currentTimeMillis();
        StructuralTransformer transformer = new StructuralTransformer(styleMap, owner, ctx);
        Element doc = owner.appendElement(Markup.ROOT);
        for (DocNode block : root.getChildren()) {
            transformer.block(block, doc);
        }
        resolveBookmarkLinks(doc, ctx);
        log.info("[{}] 结构转换完成: {} 个块, 表格 {} 个, 耗时 {} ms", ctx.getDocumentName(),
                doc.children().size(), ctx.getReport().getTableCount(), System.currentTimeMillis() - start);
        return doc;
    }

    private void block(DocNode block, Element parent) {
        if (block.is(NodeType.PARAGRAPH)) {
            parent.appendChild(paragraph(block));
        } else if (block.is(NodeType.TABLE)) {
            resetCounters();
            parent.appendChild(table(block));
        } else {
            ctx.anomaly("块级位置出现 " + block.getType() + "，内容透传");
            Element p = newElement("p").attr(Markup.ROLE, ParagraphRole.PARA.getValue());
            renderInline(block.getChildren(), p);
            parent.appendChild(p);
        }
    }

    // ==================== 段落 ====================

    /**
     * 段落角色判定结果
     */
    private static final class Classified {
        ParagraphRole role = ParagraphRole.PARA;
        int level;
        ListType listType;
        boolean plain = true;
    }

    Classified classify(DocNode para) {
        Classified c = new Classified();
        String style = para.getStyleClass();
        StyleMap.StyleMatch match = styleMap.matchParagraph(style);
        if (match != null && match.getRole() != ParagraphRole.PARA) {
            c.role = match.getRole();
            c.level = match.getLevel();
            c.listType = match.getListType();
            c.plain = match.isPlain();
            if (c.role == ParagraphRole.LIST_ITEM && c.level == 0) {
                c.level = para.intAttr(DocNode.ATTR_LIST_LEVEL, 1);
            }
        } else if (para.hasAttr(DocNode.ATTR_LIST_LEVEL)) {
            c.role = ParagraphRole.LIST_ITEM;
            c.level = para.intAttr(DocNode.ATTR_LIST_LEVEL, 1);
            c.listType = ListType.fromNumFormat(para.attr(DocNode.ATTR_NUM_FORMAT));
        } else if (match == null && para.intAttr(DocNode.ATTR_OUTLINE_LEVEL, 9) <= 5) {
            c.role = ParagraphRole.HEADING;
            c.level = para.intAttr(DocNode.ATTR_OUTLINE_LEVEL, 0) + 1;
        } else {
            c.plain = style == null || (match != null && match.isPlain());
        }
        if (c.role == ParagraphRole.LIST_ITEM && c.listType == null) {
            c.listType = ListType.BULLET;
        }
        if (c.role == ParagraphRole.LIST_ITEM || c.role == ParagraphRole.HEADING) {
            c.level = Math.max(1, Math.min(MAX_LEVEL, c.level));
        }
        return c;
    }

    private Element paragraph(DocNode para) {
        Classified c = classify(para);
        Element p = newElement("p").attr(Markup.ROLE, c.role.getValue());
        String style = para.getStyleClass();
        if (style != null) {
            p.attr(Markup.STYLE, style);
            if (!c.plain && (c.role == ParagraphRole.PARA || c.role == ParagraphRole.MARKER)) {
                p.attr(Markup.CONTENT_TYPE, style);
            }
        }
        if (para.hasAttr(DocNode.ATTR_JUSTIFY)) {
            p.attr(Markup.JUSTIFY, para.attr(DocNode.ATTR_JUSTIFY));
        }
        renderInline(para.getChildren(), p);

        if (c.role == ParagraphRole.LIST_ITEM) {
            listItem(p, c);
        } else {
            resetCounters();
            if (c.role == ParagraphRole.HEADING) {
                p.attr(Markup.LEVEL, String.valueOf(c.level));
            }
        }
        replaceTabs(p);
        XmlUtils.removeEmptyWrappers(p);
        InlineCoalescer.coalesce(p);
        return p;
    }

    private void listItem(Element p, Classified c) {
        int level = c.level;
        for (int l = level + 1; l <= MAX_LEVEL; l++) {
            counters[l] = 0;
            counterTypes[l] = null;
        }
        if (counterTypes[level] != c.listType) {
            counters[level] = 0;
            counterTypes[level] = c.listType;
        }
        counters[level]++;

        String label = detachManualLabel(p);
        if (label == null) {
            label = c.listType.label(counters[level]);
        }
        XmlUtils.trimLeading(p);
        p.attr(Markup.LEVEL, String.valueOf(level));
        p.attr(Markup.LIST_TYPE, c.listType.getValue());
        p.attr(Markup.LABEL, label);
    }

    /**
     * 分离手工输入的列表标签（制表符之前的部分）
     *
     * @return 标签文字；没有手工标签返回 null
     */
    private static String detachManualLabel(Element p) {
        String text = XmlUtils.rawText(p);
        int tab = text.indexOf('\t');
        if (tab < 0) {
            return null;
        }
        Matcher m = MANUAL_LABEL.matcher(text.substring(0, tab));
        if (!m.matches()) {
            return null;
        }
        XmlUtils.removeLeadingChars(p, tab + 1);
        return m.group(1);
    }

    private void resetCounters() {
        for (int l = 0; l <= MAX_LEVEL; l++) {
            counters[l] = 0;
            counterTypes[l] = null;
        }
    }

    /**
     * 制表符输出为空格
     */
    private static void replaceTabs(Element root) {
        for (TextNode text : XmlUtils.textNodes(root)) {
            String value = text.getWholeText();
            if (value.indexOf('\t') >= 0) {
                text.text(value.replace('\t', ' '));
            }
        }
    }

    // ==================== 行内 ====================

    void renderInline(List<DocNode> nodes, Element parent) {
        for (DocNode node : coalesceRuns(nodes)) {
            switch (node.getType()) {
                case RUN:
                    renderRun(node, parent);
                    break;
                case TEXT:
                    parent.appendText(node.getText());
                    break;
                case BREAK:
                    parent.appendChild(newElement("break"));
                    break;
                case HYPERLINK:
                    hyperlink(node, parent);
                    break;
                case FIELD:
                    field(node, parent);
                    break;
                case COMMENT_RANGE:
                    parent.appendChild(commentMarker(node));
                    break;
                case BOOKMARK:
                    parent.appendChild(newElement("target").attr("id", node.attr(DocNode.ATTR_NAME)));
                    break;
                default:
                    ctx.anomaly("行内位置出现 " + node.getType() + "，内容透传");
                    renderInline(node.getChildren(), parent);
                    break;
            }
        }
    }

    /**
     * 相邻且格式完全相同（样式 + 标记）的 run 合并
     */
    static List<DocNode> coalesceRuns(List<DocNode> nodes) {
        List<DocNode> out = new ArrayList<>();
        DocNode previous = null;
        for (DocNode node : nodes) {
            if (node.is(NodeType.RUN) && previous != null && sameFormat(previous, node)) {
                for (DocNode child : node.getChildren()) {
                    previous.add(child);
                }
                continue;
            }
            if (node.is(NodeType.RUN)) {
                DocNode copy = DocNode.run(node.getStyleClass(), node.getFlags(), null);
                for (DocNode child : node.getChildren()) {
                    copy.add(child);
                }
                out.add(copy);
                previous = copy;
            } else {
                out.add(node);
                previous = null;
            }
        }
        return out;
    }

    private static boolean sameFormat(DocNode a, DocNode b) {
        String sa = a.getStyleClass();
        String sb = b.getStyleClass();
        return (sa == null ? sb == null : sa.equals(sb)) && a.getFlags().equals(b.getFlags());
    }

    private void renderRun(DocNode run, Element parent) {
        String style = run.getStyleClass();
        EnumSet<FormatFlag> flags = EnumSet.noneOf(FormatFlag.class);
        flags.addAll(run.getFlags());
        FormatFlag styleFlag = styleMap.characterFlag(style);
        if (styleFlag != null) {
            flags.add(styleFlag);
        }

        Element target = parent;
        String semantic = styleMap.characterStyle(style);
        if (semantic != null) {
            target = target.appendElement(semantic);
        } else if (styleFlag == null && !styleMap.isIgnoredCharacterStyle(style)) {
            target = target.appendElement("styled-content").attr("style-type", style);
        }
        for (String tag : InlineStyleTable.tags(flags)) {
            target = target.appendElement(tag);
        }
        for (DocNode child : run.getChildren()) {
            if (child.is(NodeType.TEXT)) {
                target.appendText(child.getText());
            } else if (child.is(NodeType.BREAK)) {
                target.appendChild(newElement("break"));
            }
        }
    }

    private void hyperlink(DocNode link, Element parent) {
        Element target;
        if (link.hasAttr(DocNode.ATTR_ANCHOR)) {
            target = newElement("xref").attr("ref-type", BOOKMARK_REF).attr("rid", link.attr(DocNode.ATTR_ANCHOR));
        } else if (link.hasAttr(DocNode.ATTR_TARGET)) {
            target = newElement("ext-link").attr("ext-link-type", "uri").attr("xlink:href", link.attr(DocNode.ATTR_TARGET));
        } else {
            renderInline(link.getChildren(), parent);
            return;
        }
        renderInline(link.getChildren(), target);
        parent.appendChild(target);
    }

    /**
     * 域：SET Table:N 声明列数；HYPERLINK / REF / PAGEREF 输出链接；其它域只保留结果
     */
    private void field(DocNode field, Element parent) {
        String instr = field.attr(DocNode.ATTR_INSTR) == null ? "" : field.attr(DocNode.ATTR_INSTR).trim();
        String[] words = instr.split("\\s+");
        String code = words[0].toUpperCase(Locale.ROOT);

        Matcher set = SET_TABLE.matcher(instr);
        if (set.find()) {
            try {
                pendingTableColumns = Integer.parseInt(set.group(1));
            } catch (NumberFormatException e) {
                // 只含数字却解析失败，说明超出 int 范围；按超大列数处理，由表格重建走合并回退
                ctx.anomaly("SET Table 声明的列数超出范围: " + set.group(1));
                pendingTableColumns = Integer.MAX_VALUE;
            }
            log.debug("[{}] SET Table 声明下一张表格 {} 列", ctx.getDocumentName(), pendingTableColumns);
            return;
        }
        if ("HYPERLINK".equals(code)) {
            Matcher local = HYPERLINK_LOCAL.matcher(instr);
            Element link;
            if (local.find()) {
                link = newElement("xref").attr("ref-type", BOOKMARK_REF).attr("rid", local.group(1));
            } else {
                Matcher quoted = QUOTED.matcher(instr);
                if (!quoted.find()) {
                    ctx.anomaly("HYPERLINK 域缺少地址: " + instr);
                    renderInline(field.getChildren(), parent);
                    return;
                }
                link = newElement("ext-link").attr("ext-link-type", "uri").attr("xlink:href", quoted.group(1));
            }
            renderInline(field.getChildren(), link);
            parent.appendChild(link);
            return;
        }
        if (("REF".equals(code) || "PAGEREF".equals(code)) && words.length > 1) {
            Element xref = newElement("xref").attr("ref-type", BOOKMARK_REF).attr("rid", words[1]);
            renderInline(field.getChildren(), xref);
            parent.appendChild(xref);
            return;
        }
        renderInline(field.getChildren(), parent);
    }

    /**
     * 书签链接收尾：找不到 target 的链接只保留文字；没有被引用的隐藏书签（_ 开头）删除
     *
     * @return 去掉的悬空链接数
     */
    static int resolveBookmarkLinks(Element doc, ConversionContext ctx) {
        Set<String> targets = new HashSet<>();
        for (Element target : doc.getElementsByTag("target")) {
            targets.add(target.id());
        }
        Set<String> referenced = new HashSet<>();
        int dangling = 0;
        for (Element xref : new ArrayList<>(doc.getElementsByTag("xref"))) {
            if (!BOOKMARK_REF.equals(xref.attr("ref-type"))) {
                continue;
            }
            String rid = xref.attr("rid");
            if (targets.contains(rid)) {
                referenced.add(rid);
                continue;
            }
            ctx.anomaly("交叉引用的书签不存在，只保留文字: " + rid);
            xref.unwrap();
            dangling++;
        }
        for (Element target : new ArrayList<>(doc.getElementsByTag("target"))) {
            if (target.id().startsWith("_") && !referenced.contains(target.id())) {
                target.remove();
            }
        }
        return dangling;
    }

    private static XmlDeclaration commentMarker(DocNode marker) {
        boolean start = DocNode.EDGE_START.equals(marker.attr(DocNode.ATTR_EDGE));
        XmlDeclaration pi = new XmlDeclaration(start ? Markup.COMMENT_START : Markup.COMMENT_END, false);
        pi.attr("id", marker.attr(DocNode.ATTR_ID) == null ? "" : marker.attr(DocNode.ATTR_ID));
        if (start && marker.attr(DocNode.ATTR_AUTHOR) != null) {
            pi.attr("author", marker.attr(DocNode.ATTR_AUTHOR));
        }
        return pi;
    }

    // ==================== 表格 ====================

    private Element table(DocNode table) {
        int declared = pendingTableColumns;
        pendingTableColumns = 0;
        ReconstructedTable grid = TableReconstructor.reconstruct(table, declared, this::isHeaderRow, ctx);

        Element el = newElement("table");
        if (table.getStyleClass() != null) {
            el.attr(Markup.CONTENT_TYPE, table.getStyleClass());
        }
        if (grid.isFallback()) {
            el.attr("specific-use", "merge-fallback");
        }
        colgroup(grid, el);

        Element thead = null;
        Element tbody = null;
        List<List<ReconstructedCell>> rows = grid.getRows();
        for (int r = 0; r < rows.size(); r++) {
            boolean header = r < grid.getHeaderRowCount();
            Element section;
            if (header) {
                if (thead == null) {
                    thead = el.appendElement("thead");
                }
                section = thead;
            } else {
                if (tbody == null) {
                    tbody = el.appendElement("tbody");
                }
                section = tbody;
            }
            Element tr = section.appendElement("tr");
            for (ReconstructedCell cell : rows.get(r)) {
                tr.appendChild(cell(cell, header ? "th" : "td"));
            }
        }
        return el;
    }

    private void colgroup(ReconstructedTable grid, Element table) {
        List<Integer> widths = grid.getColumnWidths();
        long total = 0;
        for (Integer w : widths) {
            total += w;
        }
        if (widths.isEmpty() || total <= 0) {
            return;
        }
        Element colgroup = table.appendElement("colgroup");
        for (Integer w : widths) {
            colgroup.appendElement("col").attr("width", String.format(Locale.ROOT, "%.1f%%", w * 100.0 / total));
        }
    }

    private Element cell(ReconstructedCell cell, String tag) {
        DocNode source = cell.getSource();
        Element el = newElement(tag);
        if (cell.getRowSpan() > 1) {
            el.attr("rowspan", String.valueOf(cell.getRowSpan()));
        }
        if (cell.getColSpan() > 1) {
            el.attr("colspan", String.valueOf(cell.getColSpan()));
        }

        String alignment = styleMap.shadingAlignment(source.attr(DocNode.ATTR_SHADING));
        String justify = null;
        boolean first = true;
        for (DocNode block : source.getChildren()) {
            if (block.is(NodeType.TABLE)) {
                el.appendChild(table(block));
                first = false;
                continue;
            }
            if (!block.is(NodeType.PARAGRAPH)) {
                ctx.anomaly("单元格中出现 " + block.getType() + "，已忽略");
                continue;
            }
            Element holder = newElement("p");
            renderInline(block.getChildren(), holder);
            replaceTabs(holder);
            XmlUtils.removeEmptyWrappers(holder);
            if (XmlUtils.isEmpty(holder)) {
                continue;
            }
            if (justify == null) {
                justify = block.attr(DocNode.ATTR_JUSTIFY);
            }
            if (!first) {
                el.appendChild(newElement("break"));
            }
            XmlUtils.moveChildren(holder, el);
            first = false;
        }

        if ("decimal".equals(alignment)) {
            el.attr("align", "char").attr("char", ".");
        } else if (alignment != null) {
            el.attr("align", alignment);
        } else if (justify != null) {
            String align = justifyToAlign(justify);
            if (align != null) {
                el.attr("align", align);
            }
        }
        if ("true".equals(source.attr(DocNode.ATTR_NO_BOTTOM_BORDER))) {
            el.attr("rowsep", "0");
        }
        if ("true".equals(source.attr(DocNode.ATTR_NO_RIGHT_BORDER))) {
            el.attr("colsep", "0");
        }
        InlineCoalescer.coalesce(el);
        return el;
    }

    private static String justifyToAlign(String jc) {
        switch (jc) {
            case "center":
                return "center";
            case "right":
            case "end":
                return "right";
            case "both":
            case "distribute":
                return "justify";
            case "left":
            case "start":
                return "left";
            default:
                return null;
        }
    }

    /**
     * 表头行：w:tblHeader 标记的行，或所有非空段落都是列标题样式的行
     */
    private boolean isHeaderRow(DocNode row) {
        if ("true".equals(row.attr(DocNode.ATTR_HEADER_ROW))) {
            return true;
        }
        boolean any = false;
        for (DocNode cell : row.getChildren()) {
            for (DocNode block : cell.getChildren()) {
                if (!block.is(NodeType.PARAGRAPH) || block.plainText().trim().isEmpty()) {
                    continue;
                }
                StyleMap.StyleMatch match = styleMap.matchParagraph(block.getStyleClass());
                if (match == null || match.getRole() != ParagraphRole.TABLE_COLUMN_HEAD) {
                    return false;
                }
                any = true;
            }
        }
        return any;
    }

    private Element newElement(String tag) {
        return owner.createElement(tag);
    }
}

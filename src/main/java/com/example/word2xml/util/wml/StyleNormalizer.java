package com.example.word2xml.util.wml;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.wml.dto.DocNode;
import com.example.word2xml.util.wml.dto.FormatFlag;
import com.example.word2xml.util.wml.dto.NodeType;
import com.example.word2xml.util.wml.dto.SourceDocument;
import com.example.word2xml.util.wml.dto.VMergeState;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 样式规范化（流水线第一阶段）
 *
 * 功能：
 * 1. 删除修订痕迹：w:del / w:moveFrom 连同被删文本一起移除，不留残余
 * 2. 剥离只做标注的包装元素（smartTag、customXml、sdt、ins 等），子元素提升到父级
 * 3. 数字开头的样式ID加前缀 "A"，避免与内部合成名冲突
 * 4. 复杂域（fldChar begin/separate/end）折叠为一个 FIELD 节点
 * 5. 预计算表格信息：列宽列表、每个单元格的网格起始列、gridSpan、vMerge、边框和底纹
 *
 * 原则：尽力而为，遇到意外结构原样透传内容，不抛异常
 */
@Slf4j
public class StyleNormalizer {

    /** 样式ID前缀 */
    public static final String STYLE_ID_PREFIX = "A";

    /** 标注型包装元素：剥掉自身，子元素提升 */
    private static final Set<String> PROMOTED_WRAPPERS = new HashSet<>(Arrays.asList(
            "w:smarttag", "w:customxml", "w:sdt", "w:sdtcontent", "w:ins", "w:moveto", "w:dir", "w:bdo"));

    /** 连同内容一起删除的元素 */
    private static final Set<String> REMOVED_WITH_CONTENT = new HashSet<>(Arrays.asList(
            "w:del", "w:movefrom", "w:deltext", "w:delinstrtext", "w:sdtpr", "w:sectpr",
            "w:moveFromRangeStart".toLowerCase(), "w:moveFromRangeEnd".toLowerCase()));

    /** 无内容的标注元素，直接忽略 */
    private static final Set<String> IGNORED_MARKERS = new HashSet<>(Arrays.asList(
            "w:prooferr", "w:bookmarkend", "w:permstart", "w:permend", "w:lastrenderedpagebreak",
            "w:commentreference", "w:tblpr", "w:tblgrid", "w:trpr", "w:tcpr", "w:ppr", "w:rpr",
            "w:moveToRangeStart".toLowerCase(), "w:moveToRangeEnd".toLowerCase(),
            "w:annotationref", "w:footnoteref", "w:endnoteref", "w:separator", "w:continuationseparator"));

    // 域折叠时使用的临时标记属性
    private static final String MARK_FLD_CHAR = "fldChar";
    private static final String MARK_INSTR_TEXT = "instrText";

    private static final String GO_BACK = "_GoBack";

    private final SourceDocument source;
    private final ConversionContext ctx;

    private StyleNormalizer(SourceDocument source, ConversionContext ctx) {
        this.source = source;
        this.ctx = ctx;
    }

    /**
     * 规范化原始标记树
     *
     * @param raw    WmlReader 解析得到的原始树
     * @param source 源文档（提供超链接、编号格式、批注作者映射）
     * @param ctx    转换上下文
     * @return DOCUMENT 根节点
     */
    public static DocNode normalize(Document raw, SourceDocument source, ConversionContext ctx) {
        long start = System.currentTimeMillis();
        DocNode root = new DocNode(NodeType.DOCUMENT);
        Element body = WmlReader.findBody(raw);
        if (body == null) {
            ctx.anomaly("document.xml 中没有 w:body");
            return root;
        }
        StyleNormalizer normalizer = new StyleNormalizer(source, ctx);
        for (DocNode block : normalizer.blocks(body)) {
            root.add(block);
        }
        log.info("[{}] 样式规范化完成: {} 个块, 耗时 {} ms",
                ctx.getDocumentName(), root.getChildren().size(), System.currentTimeMillis() - start);
        return root;
    }

    /**
     * 样式ID规范化：数字开头的ID加前缀，已加过前缀的保持不变
     */
    public static String normalizeStyleId(String styleId) {
        if (styleId == null || styleId.isEmpty()) {
            return null;
        }
        if (Character.isDigit(styleId.charAt(0))) {
            return STYLE_ID_PREFIX + styleId;
        }
        return styleId;
    }

    // ==================== 块级 ====================

    private List<DocNode> blocks(Element container) {
        List<DocNode> out = new ArrayList<>();
        for (Element child : container.children()) {
            String name = child.normalName();
            if ("w:p".equals(name)) {
                out.add(paragraph(child));
            } else if ("w:tbl".equals(name)) {
                out.add(table(child));
            } else if (REMOVED_WITH_CONTENT.contains(name) || IGNORED_MARKERS.contains(name)) {
                continue;
            } else if (PROMOTED_WRAPPERS.contains(name)) {
                out.addAll(blocks(child));
            } else if ("w:bookmarkstart".equals(name)) {
                DocNode bookmark = bookmark(child);
                if (bookmark != null) {
                    DocNode holder = DocNode.paragraph(null);
                    holder.add(bookmark);
                    out.add(holder);
                }
            } else {
                // 未知块级元素：透传其中可识别的内容
                ctx.anomaly("未识别的块级元素 " + child.tagName() + "，内容透传");
                out.addAll(blocks(child));
            }
        }
        return out;
    }

    private DocNode paragraph(Element p) {
        DocNode para = DocNode.paragraph(null);
        Element pPr = firstChild(p, "w:ppr");
        if (pPr != null) {
            Element pStyle = firstChild(pPr, "w:pstyle");
            if (pStyle != null) {
                para.setStyleClass(normalizeStyleId(pStyle.attr("w:val")));
            }
            Element numPr = firstChild(pPr, "w:numpr");
            if (numPr != null) {
                Element ilvl = firstChild(numPr, "w:ilvl");
                Element numId = firstChild(numPr, "w:numid");
                int level = ilvl != null ? parseInt(ilvl.attr("w:val"), 0) : 0;
                String num = numId != null ? numId.attr("w:val") : "";
                // numId=0 表示显式取消编号
                if (!"0".equals(num)) {
                    para.attr(DocNode.ATTR_LIST_LEVEL, String.valueOf(level + 1));
                    para.attr(DocNode.ATTR_NUM_FORMAT, source.numberingFormat(num, level));
                }
            }
            Element outline = firstChild(pPr, "w:outlinelvl");
            if (outline != null) {
                para.attr(DocNode.ATTR_OUTLINE_LEVEL, outline.attr("w:val"));
            }
            Element jc = firstChild(pPr, "w:jc");
            if (jc != null) {
                para.attr(DocNode.ATTR_JUSTIFY, jc.attr("w:val"));
            }
        }
        for (DocNode node : foldFields(inline(p))) {
            para.add(node);
        }
        return para;
    }

    private DocNode table(Element tbl) {
        DocNode table = new DocNode(NodeType.TABLE);
        Element tblPr = firstChild(tbl, "w:tblpr");
        if (tblPr != null) {
            Element tblStyle = firstChild(tblPr, "w:tblstyle");
            if (tblStyle != null) {
                table.setStyleClass(normalizeStyleId(tblStyle.attr("w:val")));
            }
        }
        Element grid = firstChild(tbl, "w:tblgrid");
        if (grid != null) {
            List<String> widths = new ArrayList<>();
            for (Element col : grid.children()) {
                if ("w:gridcol".equals(col.normalName())) {
                    widths.add(String.valueOf(parseInt(col.attr("w:w"), 0)));
                }
            }
            table.attr(DocNode.ATTR_GRID_WIDTHS, String.join(",", widths));
        } else {
            ctx.anomaly("表格缺少 w:tblGrid");
        }

        for (Element tr : collect(tbl, "w:tr")) {
            Element trPr = firstChild(tr, "w:trpr");
            if (trPr != null && firstChild(trPr, "w:del") != null) {
                // 整行被修订删除
                continue;
            }
            DocNode row = new DocNode(NodeType.ROW);
            int gridCol = 0;
            if (trPr != null) {
                Element gridBefore = firstChild(trPr, "w:gridbefore");
                if (gridBefore != null) {
                    gridCol = parseInt(gridBefore.attr("w:val"), 0);
                }
                if (firstChild(trPr, "w:tblheader") != null && isOn(firstChild(trPr, "w:tblheader"))) {
                    row.attr(DocNode.ATTR_HEADER_ROW, "true");
                }
            }
            for (Element tc : collect(tr, "w:tc")) {
                DocNode cell = cell(tc, gridCol);
                gridCol += cell.intAttr(DocNode.ATTR_GRID_SPAN, 1);
                row.add(cell);
            }
            table.add(row);
        }
        return table;
    }

    private DocNode cell(Element tc, int gridCol) {
        DocNode cell = new DocNode(NodeType.CELL);
        int span = 1;
        VMergeState vMerge = VMergeState.NONE;
        Element tcPr = firstChild(tc, "w:tcpr");
        if (tcPr != null) {
            Element gridSpan = firstChild(tcPr, "w:gridspan");
            if (gridSpan != null) {
                span = Math.max(1, parseInt(gridSpan.attr("w:val"), 1));
            }
            Element vm = firstChild(tcPr, "w:vmerge");
            if (vm != null) {
                // <w:vMerge/> 不带 val 等同于 continue
                String val = vm.attr("w:val");
                vMerge = val.isEmpty() ? VMergeState.CONTINUE : VMergeState.fromAttribute(val);
            }
            Element borders = firstChild(tcPr, "w:tcborders");
            if (borders != null) {
                if (isSuppressedBorder(firstChild(borders, "w:bottom"))) {
                    cell.attr(DocNode.ATTR_NO_BOTTOM_BORDER, "true");
                }
                Element right = firstChild(borders, "w:right");
                if (right == null) {
                    right = firstChild(borders, "w:end");
                }
                if (isSuppressedBorder(right)) {
                    cell.attr(DocNode.ATTR_NO_RIGHT_BORDER, "true");
                }
            }
            Element shd = firstChild(tcPr, "w:shd");
            if (shd != null && !shd.attr("w:fill").isEmpty() && !"auto".equalsIgnoreCase(shd.attr("w:fill"))) {
                cell.attr(DocNode.ATTR_SHADING, shd.attr("w:fill").toUpperCase());
            }
        }
        cell.attr(DocNode.ATTR_GRID_COL, String.valueOf(gridCol));
        cell.attr(DocNode.ATTR_GRID_SPAN, String.valueOf(span));
        cell.attr(DocNode.ATTR_VMERGE, vMerge.name());
        for (DocNode block : blocks(tc)) {
            cell.add(block);
        }
        return cell;
    }

    // ==================== 行内 ====================

    private List<DocNode> inline(Element container) {
        List<DocNode> out = new ArrayList<>();
        for (Element child : container.children()) {
            String name = child.normalName();
            switch (name) {
                case "w:r":
                    out.addAll(run(child));
                    break;
                case "w:hyperlink":
                    out.add(hyperlink(child));
                    break;
                case "w:fldsimple": {
                    DocNode field = new DocNode(NodeType.FIELD);
                    field.attr(DocNode.ATTR_INSTR, child.attr("w:instr").trim());
                    for (DocNode node : foldFields(inline(child))) {
                        field.add(node);
                    }
                    out.add(field);
                    break;
                }
                case "w:commentrangestart":
                case "w:commentrangeend": {
                    DocNode marker = new DocNode(NodeType.COMMENT_RANGE);
                    String id = child.attr("w:id");
                    marker.attr(DocNode.ATTR_ID, id);
                    marker.attr(DocNode.ATTR_EDGE, name.endsWith("start") ? DocNode.EDGE_START : DocNode.EDGE_END);
                    marker.attr(DocNode.ATTR_AUTHOR, source.getCommentAuthors().get(id));
                    out.add(marker);
                    break;
                }
                case "w:bookmarkstart": {
                    DocNode bookmark = bookmark(child);
                    if (bookmark != null) {
                        out.add(bookmark);
                    }
                    break;
                }
                default:
                    if (REMOVED_WITH_CONTENT.contains(name) || IGNORED_MARKERS.contains(name)) {
                        break;
                    }
                    if (!PROMOTED_WRAPPERS.contains(name)) {
                        ctx.anomaly("未识别的行内元素 " + child.tagName() + "，内容透传");
                    }
                    out.addAll(inline(child));
                    break;
            }
        }
        return out;
    }

    private DocNode hyperlink(Element link) {
        DocNode node = new DocNode(NodeType.HYPERLINK);
        String anchor = link.attr("w:anchor");
        if (!anchor.isEmpty()) {
            node.attr(DocNode.ATTR_ANCHOR, anchor);
        } else {
            String relId = link.attr("r:id");
            String target = source.getHyperlinkTargets().get(relId);
            if (target == null && !relId.isEmpty()) {
                ctx.anomaly("超链接关系 " + relId + " 未找到目标地址");
            }
            node.attr(DocNode.ATTR_TARGET, target);
        }
        for (DocNode child : foldFields(inline(link))) {
            node.add(child);
        }
        return node;
    }

    private DocNode bookmark(Element start) {
        String name = start.attr("w:name");
        // _GoBack 只记录上次编辑位置；_Ref、_Toc 等隐藏书签是交叉引用的目标，保留
        if (name.isEmpty() || GO_BACK.equals(name)) {
            return null;
        }
        DocNode node = new DocNode(NodeType.BOOKMARK);
        node.attr(DocNode.ATTR_NAME, name);
        node.attr(DocNode.ATTR_ID, start.attr("w:id"));
        return node;
    }

    /**
     * 处理一个 w:r；run 中的 fldChar/instrText 作为独立标记输出，
     * 因此一个 w:r 可能拆成多个节点
     */
    private List<DocNode> run(Element r) {
        List<DocNode> out = new ArrayList<>();
        String style = null;
        EnumSet<FormatFlag> flags = EnumSet.noneOf(FormatFlag.class);
        Element rPr = firstChild(r, "w:rpr");
        if (rPr != null) {
            Element rStyle = firstChild(rPr, "w:rstyle");
            if (rStyle != null) {
                style = normalizeStyleId(rStyle.attr("w:val"));
            }
            readFlags(rPr, flags);
        }

        DocNode current = null;
        for (Element child : r.children()) {
            String name = child.normalName();
            DocNode piece = null;
            switch (name) {
                case "w:t":
                    piece = DocNode.text(wholeText(child));
                    break;
                case "w:tab":
                case "w:ptab":
                    piece = DocNode.text("\t");
                    break;
                case "w:nobreakhyphen":
                    piece = DocNode.text("‑");
                    break;
                case "w:br":
                case "w:cr":
                    if ("page".equals(child.attr("w:type")) || "column".equals(child.attr("w:type"))) {
                        break;
                    }
                    piece = new DocNode(NodeType.BREAK);
                    break;
                case "w:fldchar": {
                    DocNode marker = new DocNode(NodeType.FIELD);
                    marker.attr(MARK_FLD_CHAR, child.attr("w:fldCharType"));
                    out.add(marker);
                    current = null;
                    break;
                }
                case "w:instrtext": {
                    DocNode marker = new DocNode(NodeType.FIELD);
                    marker.attr(MARK_INSTR_TEXT, wholeText(child));
                    out.add(marker);
                    current = null;
                    break;
                }
                case "w:sym":
                    ctx.anomaly("符号字符 w:sym(" + child.attr("w:char") + ") 未转换");
                    break;
                default:
                    // rPr、softHyphen、drawing、删除文本等不产生文本
                    break;
            }
            if (piece != null) {
                if (current == null) {
                    current = DocNode.run(style, flags, null);
                    out.add(current);
                }
                current.add(piece);
            }
        }
        return out;
    }

    private static void readFlags(Element rPr, Set<FormatFlag> flags) {
        for (Element prop : rPr.children()) {
            switch (prop.normalName()) {
                case "w:b":
                    if (isOn(prop)) flags.add(FormatFlag.BOLD);
                    break;
                case "w:i":
                    if (isOn(prop)) flags.add(FormatFlag.ITALIC);
                    break;
                case "w:u":
                    if (!"none".equals(prop.attr("w:val")) && isOn(prop)) flags.add(FormatFlag.UNDERLINE);
                    break;
                case "w:strike":
                case "w:dstrike":
                    if (isOn(prop)) flags.add(FormatFlag.STRIKE);
                    break;
                case "w:smallcaps":
                    if (isOn(prop)) flags.add(FormatFlag.SMALL_CAPS);
                    break;
                case "w:vertalign":
                    if ("superscript".equals(prop.attr("w:val"))) {
                        flags.add(FormatFlag.SUPERSCRIPT);
                    } else if ("subscript".equals(prop.attr("w:val"))) {
                        flags.add(FormatFlag.SUBSCRIPT);
                    }
                    break;
                default:
                    break;
            }
        }
    }

    /**
     * 复杂域折叠
     *
     * begin ... instrText ... separate ... 结果 ... end 折叠为一个 FIELD，
     * 子节点为域结果；不成对的 fldChar 记为结构异常，其结果内容按普通内容保留
     */
    private List<DocNode> foldFields(List<DocNode> items) {
        List<DocNode> out = new ArrayList<>();
        Deque<FieldFrame> stack = new ArrayDeque<>();
        for (DocNode item : items) {
            String fldChar = item.is(NodeType.FIELD) ? item.attr(MARK_FLD_CHAR) : null;
            String instrText = item.is(NodeType.FIELD) ? item.attr(MARK_INSTR_TEXT) : null;
            if (fldChar != null) {
                if ("begin".equals(fldChar)) {
                    stack.push(new FieldFrame());
                } else if ("separate".equals(fldChar)) {
                    if (stack.isEmpty()) {
                        ctx.anomaly("孤立的 fldChar separate");
                    } else {
                        stack.peek().inResult = true;
                    }
                } else if ("end".equals(fldChar)) {
                    if (stack.isEmpty()) {
                        ctx.anomaly("孤立的 fldChar end");
                    } else {
                        FieldFrame frame = stack.pop();
                        DocNode field = new DocNode(NodeType.FIELD);
                        field.attr(DocNode.ATTR_INSTR, frame.instr.toString().trim());
                        for (DocNode r : frame.result) {
                            field.add(r);
                        }
                        emit(field, stack, out);
                    }
                }
            } else if (instrText != null) {
                if (!stack.isEmpty() && !stack.peek().inResult) {
                    stack.peek().instr.append(instrText);
                } else {
                    ctx.anomaly("域结果中出现 instrText: " + instrText);
                }
            } else {
                emit(item, stack, out);
            }
        }
        // 未闭合的域：结果内容按普通内容保留
        if (!stack.isEmpty()) {
            ctx.anomaly("段落内有 " + stack.size() + " 个未闭合的域");
            List<FieldFrame> frames = new ArrayList<>(stack);
            for (int i = frames.size() - 1; i >= 0; i--) {
                out.addAll(frames.get(i).result);
            }
        }
        return out;
    }

    private static void emit(DocNode node, Deque<FieldFrame> stack, List<DocNode> out) {
        if (stack.isEmpty()) {
            out.add(node);
        } else if (stack.peek().inResult) {
            stack.peek().result.add(node);
        }
        // 指令部分的嵌套内容不输出
    }

    private static final class FieldFrame {
        final StringBuilder instr = new StringBuilder();
        final List<DocNode> result = new ArrayList<>();
        boolean inResult;
    }

    // ==================== 工具方法 ====================

    /**
     * 收集指定标签的子元素，穿过包装元素，跳过被删除的内容
     */
    private static List<Element> collect(Element parent, String tag) {
        List<Element> out = new ArrayList<>();
        for (Element child : parent.children()) {
            String name = child.normalName();
            if (tag.equals(name)) {
                out.add(child);
            } else if (PROMOTED_WRAPPERS.contains(name)) {
                out.addAll(collect(child, tag));
            }
        }
        return out;
    }

    private static Element firstChild(Element parent, String normalName) {
        for (Element child : parent.children()) {
            if (normalName.equals(child.normalName())) {
                return child;
            }
        }
        return null;
    }

    private static String wholeText(Element el) {
        StringBuilder sb = new StringBuilder();
        for (Node node : el.childNodes()) {
            if (node instanceof TextNode) {
                sb.append(((TextNode) node).getWholeText());
            }
        }
        return sb.toString();
    }

    private static boolean isOn(Element prop) {
        String val = prop.attr("w:val");
        return !("0".equals(val) || "false".equalsIgnoreCase(val) || "off".equalsIgnoreCase(val));
    }

    private static boolean isSuppressedBorder(Element border) {
        if (border == null) {
            return false;
        }
        String val = border.attr("w:val");
        return "nil".equals(val) || "none".equals(val);
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}

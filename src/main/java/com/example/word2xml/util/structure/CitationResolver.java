package com.example.word2xml.util.structure;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.common.TextUtils;
import com.example.word2xml.util.structure.dto.BibliographyEntry;
import com.example.word2xml.util.structure.dto.CitationMarker;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 文中引用解析
 *
 * 匹配规则：引用文本归一化为词元后，必须按顺序出现在参考文献的归一化文本中，且第一个词元位于开头。
 * 多个候选时，只接受作者姓氏 + 年份恰好等于引用词元的唯一条目，否则标记为 ambiguous
 */
@Slf4j
public class CitationResolver {

    public static final String CITATION_TAG = "citebib";
    private static final Pattern SEPARATOR = Pattern.compile("\\s*;\\s*");

    /**
     * 解析全部引用标记
     *
     * @param root    文档根元素
     * @param entries 参考文献条目
     * @param ctx     转换上下文
     * @return 已解析的引用数
     */
    public static int resolve(Element root, List<BibliographyEntry> entries, ConversionContext ctx) {
        for (Element el : new ArrayList<>(root.getElementsByTag(CITATION_TAG))) {
            splitMultiple(el);
        }
        int resolved = 0;
        int unresolved = 0;
        for (Element el : new ArrayList<>(root.getElementsByTag(CITATION_TAG))) {
            String text = TextUtils.collapseWhitespace(el.text());
            CitationMarker marker = match(text, entries);
            if (marker.isResolved()) {
                el.tagName("xref");
                el.attr("ref-type", "bibr").attr("rid", marker.getResolvedId());
                ctx.getReport().incrementCitationsResolved();
                resolved++;
            } else {
                el.tagName("named-content");
                el.attr("content-type", "unresolved-bibr")
                        .attr("specific-use", marker.getUnresolved().getValue());
                ctx.getReport().addUnresolvedCitation(text);
                log.warn("[{}] 引用未解析 ({}): {}", ctx.getDocumentName(), marker.getUnresolved().getValue(), text);
                unresolved++;
            }
        }
        log.info("[{}] 文中引用: 解析 {} 个, 未解析 {} 个", ctx.getDocumentName(), resolved, unresolved);
        return resolved;
    }

    /**
     * 匹配单个引用文本
     *
     * @param text    引用文本（不含标记）
     * @param entries 参考文献条目
     * @return 解析结果；相同输入总是得到相同结果
     */
    public static CitationMarker match(String text, List<BibliographyEntry> entries) {
        List<String> tokens = TextUtils.matchTokens(text);
        if (tokens.isEmpty()) {
            return CitationMarker.unresolved(text, tokens, CitationMarker.Unresolved.NO_MATCH);
        }
        List<BibliographyEntry> candidates = new ArrayList<>();
        for (BibliographyEntry entry : entries) {
            if (TextUtils.tokensInOrder(entry.getMatchText(), tokens)) {
                candidates.add(entry);
            }
        }
        if (candidates.size() == 1) {
            return CitationMarker.resolved(text, tokens, candidates.get(0).getId());
        }
        if (candidates.isEmpty()) {
            return CitationMarker.unresolved(text, tokens, CitationMarker.Unresolved.NO_MATCH);
        }

        BibliographyEntry exact = null;
        for (BibliographyEntry entry : candidates) {
            if (authorYearTokens(entry).equals(tokens)) {
                if (exact != null) {
                    return CitationMarker.unresolved(text, tokens, CitationMarker.Unresolved.AMBIGUOUS);
                }
                exact = entry;
            }
        }
        if (exact == null) {
            return CitationMarker.unresolved(text, tokens, CitationMarker.Unresolved.AMBIGUOUS);
        }
        return CitationMarker.resolved(text, tokens, exact.getId());
    }

    /**
     * 条目的作者姓氏（或机构名）+ 年份词元
     */
    static List<String> authorYearTokens(BibliographyEntry entry) {
        List<String> out = new ArrayList<>();
        for (BibliographyEntry.PersonName name : entry.getAuthors()) {
            out.addAll(TextUtils.matchTokens(name.getCollab() != null ? name.getCollab() : name.getSurname()));
        }
        out.addAll(TextUtils.matchTokens(entry.field(BibliographyEntry.Field.YEAR)));
        return out;
    }

    /**
     * "Smith, 2020; Jones, 2019" 拆成两个独立的引用，分号原样保留为文本
     */
    private static void splitMultiple(Element el) {
        String text = el.text();
        if (!text.contains(";")) {
            return;
        }
        Matcher m = SEPARATOR.matcher(text);
        int pos = 0;
        while (m.find()) {
            appendPart(el, text.substring(pos, m.start()));
            el.before(new TextNode(m.group()));
            pos = m.end();
        }
        appendPart(el, text.substring(pos));
        el.remove();
    }

    private static void appendPart(Element el, String part) {
        if (part.trim().isEmpty()) {
            if (!part.isEmpty()) {
                el.before(new TextNode(part));
            }
            return;
        }
        Element citation = el.shallowClone();
        citation.text(part);
        el.before(citation);
    }
}

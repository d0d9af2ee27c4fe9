package com.example.word2xml.util.structure;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.common.TextUtils;
import com.example.word2xml.util.common.XmlUtils;
import com.example.word2xml.util.structure.dto.BibliographyEntry;
import com.example.word2xml.util.structure.dto.BibliographyEntry.Field;
import com.example.word2xml.util.structure.dto.BibliographyEntry.PersonName;
import com.example.word2xml.util.style.ParagraphRole;
import com.example.word2xml.util.transform.Markup;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 参考文献提取
 *
 * 连续的参考文献段落合并为一个 ref-list，每段生成 ref/mixed-citation：
 * 1. 姓名：相邻的 bib-surname / bib-given-names 配对成 string-name，
 *    只隔着文本的连续姓名归入同一个 person-group
 * 2. 年份：从年份字符标记中分离出 4 位年份（可带一个区分字母，如 2020a），月日单独标记
 * 3. 其它字段按字符样式改名（source、volume、fpage ...），url / doi 生成 ext-link
 */
@Slf4j
public class BibliographyExtractor {

    private static final Pattern DATE_PART = Pattern.compile("([0-9]{4}[a-z]?)(?![0-9])|([A-Za-z]{2,})|([0-9]{1,2})(?![0-9])");
    private static final Pattern LETTER = Pattern.compile("\\p{L}");

    private static final String SURNAME = "bib-surname";
    private static final String GIVEN_NAMES = "bib-given-names";
    private static final String COLLAB = "bib-collab";

    /** 字符样式标签 -> 输出标签 + 字段 */
    private static final Map<String, String> RENAMES = new LinkedHashMap<>();
    private static final Map<String, Field> FIELDS = new LinkedHashMap<>();

    static {
        rename("bib-chapter-title", "chapter-title", Field.CHAPTER_TITLE);
        rename("bib-source", "source", Field.SOURCE);
        rename("bib-article-title", "article-title", Field.ARTICLE_TITLE);
        rename("bib-publisher", "publisher-name", Field.PUBLISHER);
        rename("bib-publisher-loc", "publisher-loc", Field.PUBLISHER_LOC);
        rename("bib-volume", "volume", Field.VOLUME);
        rename("bib-issue", "issue", Field.ISSUE);
        rename("bib-fpage", "fpage", Field.FPAGE);
        rename("bib-lpage", "lpage", Field.LPAGE);
    }

    private static void rename(String from, String to, Field field) {
        RENAMES.put(from, to);
        FIELDS.put(from, field);
    }

    /**
     * 提取全部参考文献
     *
     * @param root 文档根元素（章节嵌套之后）
     * @param ctx  转换上下文
     * @return 按出现顺序的条目
     */
    public static List<BibliographyEntry> extract(Element root, ConversionContext ctx) {
        List<BibliographyEntry> entries = new ArrayList<>();
        int lists = 0;
        for (Element p : new ArrayList<>(root.getElementsByTag("p"))) {
            if (!ParagraphRole.REFERENCE.getValue().equals(p.attr(Markup.ROLE)) || p.parent() == null) {
                continue;
            }
            Element refList = p.previousElementSibling();
            if (refList == null || !"ref-list".equals(refList.normalName())) {
                refList = new Element("ref-list");
                p.before(refList);
                lists++;
            }
            BibliographyEntry entry = entry(p, ctx);
            Element ref = new Element("ref").attr("id", entry.getId());
            Element citation = ref.appendElement("mixed-citation")
                    .attr("publication-type", entry.getPublicationType().getValue());
            XmlUtils.moveChildren(p, citation);
            refList.appendChild(ref);
            p.remove();
            entries.add(entry);
            ctx.getReport().countReferenceType(entry.getPublicationType().getValue());
        }
        log.info("[{}] 参考文献: {} 条, {} 个列表, 分类 {}", ctx.getDocumentName(), entries.size(), lists,
                ctx.getReport().getReferenceTypes());
        return entries;
    }

    /**
     * 解析单个参考文献段落（在段落内原地改写标记）
     */
    static BibliographyEntry entry(Element p, ConversionContext ctx) {
        String id = ctx.nextReferenceId();
        List<PersonName> authors = groupNames(p);
        Map<Field, String> fields = new EnumMap<>(Field.class);

        for (Element year : p.getElementsByTag("bib-year")) {
            String value = splitDate(year);
            if (value != null && !fields.containsKey(Field.YEAR)) {
                fields.put(Field.YEAR, value);
            }
        }
        for (Element el : new ArrayList<>(p.getAllElements())) {
            String tag = el.normalName();
            String renamed = RENAMES.get(tag);
            if (renamed == null) {
                continue;
            }
            Field field = FIELDS.get(tag);
            if (!fields.containsKey(field)) {
                fields.put(field, TextUtils.collapseWhitespace(el.text()));
            }
            el.tagName(renamed);
            if (field == Field.VOLUME) {
                XmlUtils.unwrapSole(el, "italic");
            }
        }
        for (Element url : new ArrayList<>(p.getElementsByTag("bib-url"))) {
            String href = TextUtils.collapseWhitespace(url.text());
            fields.putIfAbsent(Field.URL, href);
            if (XmlUtils.ancestor(url, "ext-link") != null) {
                url.unwrap();
            } else {
                url.tagName("ext-link");
                url.attr("ext-link-type", "uri").attr("xlink:href", href);
            }
        }
        for (Element doi : new ArrayList<>(p.getElementsByTag("bib-doi"))) {
            String value = TextUtils.collapseWhitespace(doi.text());
            fields.putIfAbsent(Field.DOI, value);
            doi.tagName("ext-link");
            doi.attr("ext-link-type", "doi").attr("xlink:href", value);
        }

        String matchText = TextUtils.matchKey(p.text());
        if (authors.isEmpty()) {
            ctx.anomaly("参考文献 " + id + " 没有作者标记");
        }
        BibliographyEntry entry = new BibliographyEntry(id, authors, fields, matchText);
        log.debug("[{}] 参考文献 {}: {} 位作者, 类型 {}", ctx.getDocumentName(), id, authors.size(),
                entry.getPublicationType().getValue());
        return entry;
    }

    // ==================== 作者 ====================

    /**
     * 分组并改写作者姓名，返回按出现顺序的作者
     */
    private static List<PersonName> groupNames(Element p) {
        Set<Element> parents = new LinkedHashSet<>();
        for (Element el : p.getAllElements()) {
            if (isName(el)) {
                parents.add(el.parent());
            }
        }
        List<PersonName> authors = new ArrayList<>();
        for (Element parent : parents) {
            for (List<Node> run : nameRuns(parent)) {
                Element group = new Element("person-group").attr("person-group-type", "author");
                run.get(0).before(group);
                for (Node node : run) {
                    group.appendChild(node);
                }
                pairNames(group, authors);
            }
        }
        return authors;
    }

    /**
     * 找出父元素下的姓名段：从一个姓名元素开始，到最后一个只隔着文本的姓名元素结束
     */
    private static List<List<Node>> nameRuns(Element parent) {
        List<List<Node>> runs = new ArrayList<>();
        List<Node> current = null;
        List<Node> pending = new ArrayList<>();
        for (Node node : new ArrayList<>(parent.childNodes())) {
            if (node instanceof Element && isName((Element) node)) {
                if (current == null) {
                    current = new ArrayList<>();
                    runs.add(current);
                } else {
                    current.addAll(pending);
                }
                pending.clear();
                current.add(node);
            } else if (node instanceof TextNode && current != null) {
                pending.add(node);
            } else {
                current = null;
                pending.clear();
            }
        }
        return runs;
    }

    /**
     * 在 person-group 内把姓和名配对成 string-name；机构作者改为 collab
     */
    private static void pairNames(Element group, List<PersonName> authors) {
        for (Element el : new ArrayList<>(group.children())) {
            if (el.parent() != group) {
                continue;
            }
            if (COLLAB.equals(el.normalName())) {
                el.tagName("collab");
                authors.add(new PersonName(null, null, TextUtils.collapseWhitespace(el.text())));
                continue;
            }
            Element partner = partner(el);
            Element name = new Element("string-name");
            el.before(name);
            Node node = el;
            while (node != null) {
                Node next = node.nextSibling();
                name.appendChild(node);
                if (node == partner || partner == null) {
                    break;
                }
                node = next;
            }
            String surname = null;
            String given = null;
            for (Element part : name.children()) {
                if (SURNAME.equals(part.normalName())) {
                    surname = TextUtils.collapseWhitespace(part.text());
                    part.tagName("surname");
                } else {
                    given = TextUtils.collapseWhitespace(part.text());
                    part.tagName("given-names");
                }
            }
            authors.add(new PersonName(surname, given, null));
        }
    }

    /**
     * 紧随其后的另一半姓名（姓配名、名配姓），中间只允许没有字母的文本
     */
    private static Element partner(Element el) {
        Node next = el.nextSibling();
        while (next instanceof TextNode) {
            if (LETTER.matcher(((TextNode) next).getWholeText()).find()) {
                return null;
            }
            next = next.nextSibling();
        }
        if (!(next instanceof Element)) {
            return null;
        }
        String tag = ((Element) next).normalName();
        if (SURNAME.equals(el.normalName()) && GIVEN_NAMES.equals(tag)
                || GIVEN_NAMES.equals(el.normalName()) && SURNAME.equals(tag)) {
            return (Element) next;
        }
        return null;
    }

    private static boolean isName(Element el) {
        String tag = el.normalName();
        return SURNAME.equals(tag) || GIVEN_NAMES.equals(tag) || COLLAB.equals(tag);
    }

    // ==================== 年份 ====================

    /**
     * 把年份标记拆成 year / month / day 与原样文本
     *
     * @return 年份值；没有 4 位年份返回 null
     */
    static String splitDate(Element el) {
        String text = el.text();
        Matcher m = DATE_PART.matcher(text);
        List<Node> nodes = new ArrayList<>();
        String year = null;
        int pos = 0;
        while (m.find()) {
            if (m.start() > pos) {
                nodes.add(new TextNode(text.substring(pos, m.start())));
            }
            if (m.group(1) != null) {
                if (year == null) {
                    year = m.group(1);
                }
                nodes.add(new Element("year").text(m.group(1)));
            } else if (m.group(2) != null) {
                nodes.add(new Element("month").text(m.group(2)));
            } else {
                nodes.add(new Element("day").text(m.group(3)));
            }
            pos = m.end();
        }
        if (pos < text.length()) {
            nodes.add(new TextNode(text.substring(pos)));
        }
        for (Node node : nodes) {
            el.before(node);
        }
        el.remove();
        return year;
    }
}

package com.example.word2xml.util;

import com.example.word2xml.util.common.XmlUtils;
import com.example.word2xml.util.structure.SemanticStructurer;
import com.example.word2xml.util.style.LabelTable;
import com.example.word2xml.util.style.StyleMap;
import com.example.word2xml.util.transform.StructuralTransformer;
import com.example.word2xml.util.wml.StyleNormalizer;
import com.example.word2xml.util.wml.WmlReader;
import com.example.word2xml.util.wml.dto.DocNode;
import com.example.word2xml.util.wml.dto.SourceDocument;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/**
 * Word 转出版 XML 的完整流程
 *
 * 解析 -> 样式规范化 -> 结构转换（含表格重建） -> 语义结构化 -> 序列化。
 * 实例只持有只读的映射表，可以被多个线程同时使用；每次转换的计数器都在新建的 ConversionContext 中
 */
@Slf4j
public class WordToXmlConverter {

    public static final String XML_DECLARATION = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>";

    private final StyleMap styleMap;
    private final SemanticStructurer structurer;
    private final boolean prettyPrint;

    public WordToXmlConverter(StyleMap styleMap, LabelTable labels, boolean prettyPrint) {
        this.styleMap = styleMap;
        this.structurer = new SemanticStructurer(labels);
        this.prettyPrint = prettyPrint;
    }

    /**
     * 转换结果
     */
    public static class Result {
        private final String xml;
        private final ConversionReport report;

        Result(String xml, ConversionReport report) {
            this.xml = xml;
            this.report = report;
        }

        /** 带 XML 声明的完整输出 */
        public String getXml() { return xml; }

        public ConversionReport getReport() { return report; }
    }

    /**
     * 转换一个文档
     *
     * @param source 已解包的文档
     * @return 输出 XML 与统计报告
     */
    public Result convert(SourceDocument source) {
        long start = System.currentTimeMillis();
        ConversionContext ctx = new ConversionContext(source.getName());

        Document raw = WmlReader.parse(source);
        DocNode normalized = StyleNormalizer.normalize(raw, source, ctx);

        Document output = XmlUtils.newXmlDocument(prettyPrint);
        Element doc = StructuralTransformer.transform(normalized, styleMap, output, ctx);
        Element book = structurer.structure(doc, ctx);

        String xml = XML_DECLARATION + (prettyPrint ? "\n" : "") + book.outerHtml();
        log.info("[{}] 转换完成: 输出 {} 字符, 结构异常 {} 处, 未解析引用 {} 个, 总耗时 {} ms",
                source.getName(), xml.length(), ctx.getReport().getAnomalies().size(),
                ctx.getReport().getUnresolvedCitations().size(), System.currentTimeMillis() - start);
        return new Result(xml, ctx.getReport());
    }
}

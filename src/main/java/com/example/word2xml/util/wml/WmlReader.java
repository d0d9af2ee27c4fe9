package com.example.word2xml.util.wml;

import com.example.word2xml.util.wml.dto.SourceDocument;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

/**
 * WordprocessingML 读取工具
 * 使用 jsoup 的 XML 解析器把 document.xml 解析为原始标记树
 */
public class WmlReader {

    /**
     * 解析 document.xml 原文
     *
     * @param source 源文档
     * @return jsoup XML 文档（标签名保留 w: 前缀）
     */
    public static Document parse(SourceDocument source) {
        return parse(source.getDocumentXml());
    }

    public static Document parse(String documentXml) {
        return Jsoup.parse(documentXml == null ? "" : documentXml, "", Parser.xmlParser());
    }

    /**
     * 定位 w:body；找不到时返回 null
     */
    public static Element findBody(Document doc) {
        return doc.getElementsByTag("w:body").first();
    }
}

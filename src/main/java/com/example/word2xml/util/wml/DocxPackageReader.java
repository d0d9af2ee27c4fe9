package com.example.word2xml.util.wml;

import com.example.word2xml.util.wml.dto.SourceDocument;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFComment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFHyperlink;
import org.apache.poi.xwpf.usermodel.XWPFNumbering;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * DOCX 包读取工具
 *
 * 从 .docx 中取出转换需要的部件：
 * - word/document.xml 原文
 * - 超链接关系（rId -> URL）
 * - 编号定义（numId + ilvl -> numFmt）
 * - 批注作者
 */
@Slf4j
public class DocxPackageReader {

    /**
     * 读取 docx 文件
     *
     * @param docxPath docx 文件路径
     * @return 源文档
     * @throws IOException 文件不存在或不是有效的 docx 包
     */
    public static SourceDocument read(Path docxPath) throws IOException {
        File docxFile = docxPath.toFile();
        if (!docxFile.exists()) {
            throw new FileNotFoundException("DOCX文件不存在: " + docxPath);
        }

        String name = docxFile.getName().replaceAll("(?i)\\.docx$", "");
        try (FileInputStream fis = new FileInputStream(docxFile);
             XWPFDocument doc = new XWPFDocument(fis)) {

            // 1. 主文档部件原文
            String documentXml;
            try (InputStream is = doc.getPackagePart().getInputStream()) {
                documentXml = new String(is.readAllBytes(), StandardCharsets.UTF_8);
            }
            SourceDocument source = new SourceDocument(name, documentXml);

            // 2. 超链接关系
            for (XWPFHyperlink link : doc.getHyperlinks()) {
                source.withHyperlink(link.getId(), link.getURL());
            }

            // 3. 编号定义
            XWPFNumbering numbering = doc.getNumbering();
            if (numbering != null) {
                try (InputStream is = numbering.getPackagePart().getInputStream()) {
                    readNumbering(new String(is.readAllBytes(), StandardCharsets.UTF_8), source);
                }
            }

            // 4. 批注作者
            XWPFComment[] comments = doc.getComments();
            if (comments != null) {
                for (XWPFComment comment : comments) {
                    source.withCommentAuthor(comment.getId(), comment.getAuthor());
                }
            }

            log.info("读取DOCX完成: {}, 超链接 {} 个, 编号定义 {} 个",
                    name, source.getHyperlinkTargets().size(), source.getNumberingFormats().size());
            return source;
        } catch (org.apache.poi.ooxml.POIXMLException | org.apache.poi.openxml4j.exceptions.NotOfficeXmlFileException e) {
            throw new IOException("无效的DOCX文件: " + docxPath + ", " + e.getMessage(), e);
        }
    }

    /**
     * 解析 numbering.xml：w:num(numId -> abstractNumId)，w:abstractNum/w:lvl(ilvl -> numFmt)
     */
    static void readNumbering(String numberingXml, SourceDocument source) {
        Document doc = WmlReader.parse(numberingXml);

        Map<String, Map<Integer, String>> abstractFormats = new HashMap<>();
        for (Element abstractNum : doc.getElementsByTag("w:abstractNum")) {
            Map<Integer, String> levels = new HashMap<>();
            for (Element lvl : abstractNum.getElementsByTag("w:lvl")) {
                Element numFmt = lvl.getElementsByTag("w:numFmt").first();
                if (numFmt == null) {
                    continue;
                }
                try {
                    levels.put(Integer.parseInt(lvl.attr("w:ilvl")), numFmt.attr("w:val"));
                } catch (NumberFormatException e) {
                    log.debug("编号级别无效: {}", lvl.attr("w:ilvl"));
                }
            }
            abstractFormats.put(abstractNum.attr("w:abstractNumId"), levels);
        }

        for (Element num : doc.getElementsByTag("w:num")) {
            Element abstractRef = num.getElementsByTag("w:abstractNumId").first();
            if (abstractRef == null) {
                continue;
            }
            Map<Integer, String> levels = abstractFormats.get(abstractRef.attr("w:val"));
            if (levels == null) {
                continue;
            }
            for (Map.Entry<Integer, String> e : levels.entrySet()) {
                source.withNumberingFormat(num.attr("w:numId"), e.getKey(), e.getValue());
            }
        }
    }
}

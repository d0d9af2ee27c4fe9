package com.example.word2xml.util;

import lombok.extern.slf4j.Slf4j;

/**
 * 单次转换的上下文
 *
 * 文档级序号计数器（章节、参考文献、图、表、关键词）都放在这里，
 * 每次转换新建一个实例，各阶段通过参数传递，不使用全局可变状态
 */
@Slf4j
public class ConversionContext {

    private final String documentName;
    private final ConversionReport report = new ConversionReport();

    /** 章号（来自 ChapterNumber 段落），ID 前缀使用 */
    private String chapterNumber = "1";

    private int sectionSeq = 0;
    private int referenceSeq = 0;
    private int figureSeq = 0;
    private int tableSeq = 0;
    private int keyTermSeq = 0;

    public ConversionContext(String documentName) {
        this.documentName = documentName;
        this.report.setDocument(documentName);
    }

    public String getDocumentName() { return documentName; }

    public ConversionReport getReport() { return report; }

    public String getChapterNumber() { return chapterNumber; }

    public void setChapterNumber(String chapterNumber) {
        if (chapterNumber != null && !chapterNumber.isEmpty()) {
            this.chapterNumber = chapterNumber;
        }
    }

    public String nextSectionId(int level) {
        return "ch" + chapterNumber + "lev" + level + "sec" + (++sectionSeq);
    }

    public String nextReferenceId() {
        return "bid_" + chapterNumber + "_" + (++referenceSeq);
    }

    public String nextFigureId() {
        return "fig" + chapterNumber + "_" + (++figureSeq);
    }

    public String nextTableId() {
        return "tab" + chapterNumber + "_" + (++tableSeq);
    }

    public String nextKeyTermId() {
        return "term" + (++keyTermSeq);
    }

    public int getSectionCount() { return sectionSeq; }

    public int getReferenceCount() { return referenceSeq; }

    /**
     * 记录结构异常（非致命，原样透传后继续处理）
     */
    public void anomaly(String message) {
        log.debug("[{}] 结构异常: {}", documentName, message);
        report.addAnomaly(message);
    }
}

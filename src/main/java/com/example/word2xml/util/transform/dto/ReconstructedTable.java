package com.example.word2xml.util.transform.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 重建后的表格网格
 *
 * rows 与源表格的行一一对应；每行只包含起点单元格。
 * fallback 为 true 时合并信息已丢弃，所有源单元格都按 1x1 输出
 */
public class ReconstructedTable {

    private final int columnCount;
    private final List<Integer> columnWidths;
    private final List<List<ReconstructedCell>> rows;
    private final int headerRowCount;
    private final boolean fallback;

    public ReconstructedTable(int columnCount, List<Integer> columnWidths, List<List<ReconstructedCell>> rows,
                              int headerRowCount, boolean fallback) {
        this.columnCount = columnCount;
        this.columnWidths = columnWidths == null ? new ArrayList<Integer>() : columnWidths;
        this.rows = rows;
        this.headerRowCount = headerRowCount;
        this.fallback = fallback;
    }

    /** 声明的网格列数 */
    public int getColumnCount() { return columnCount; }

    public List<Integer> getColumnWidths() { return Collections.unmodifiableList(columnWidths); }

    public List<List<ReconstructedCell>> getRows() { return Collections.unmodifiableList(rows); }

    /** 表头行数（连续的开头几行） */
    public int getHeaderRowCount() { return headerRowCount; }

    public boolean isFallback() { return fallback; }

    /**
     * 计算每行实际占用的列数：本行起点单元格的列跨度 + 上方纵向合并延续下来的列跨度
     */
    public int[] rowOccupancy() {
        int[] occupied = new int[rows.size()];
        for (int r = 0; r < rows.size(); r++) {
            for (ReconstructedCell cell : rows.get(r)) {
                int last = Math.min(rows.size() - 1, r + cell.getRowSpan() - 1);
                for (int covered = r; covered <= last; covered++) {
                    occupied[covered] += cell.getColSpan();
                }
            }
        }
        return occupied;
    }

    public int cellCount() {
        int count = 0;
        for (List<ReconstructedCell> row : rows) {
            count += row.size();
        }
        return count;
    }
}

package com.example.word2xml.util.transform.dto;

import com.example.word2xml.util.wml.dto.DocNode;

/**
 * 重建后的单元格（只包含合并起点单元格，续接单元格不输出）
 */
public class ReconstructedCell {

    private final int row;
    private final int gridCol;
    private final int rowSpan;
    private final int colSpan;
    private final DocNode source;

    public ReconstructedCell(int row, int gridCol, int rowSpan, int colSpan, DocNode source) {
        this.row = row;
        this.gridCol = gridCol;
        this.rowSpan = rowSpan;
        this.colSpan = colSpan;
        this.source = source;
    }

    public int getRow() { return row; }

    /** 网格起始列（从0起，已计入前面单元格的 gridSpan） */
    public int getGridCol() { return gridCol; }

    public int getRowSpan() { return rowSpan; }

    public int getColSpan() { return colSpan; }

    /** 源 CELL 节点 */
    public DocNode getSource() { return source; }

    @Override
    public String toString() {
        return "Cell[r" + row + ",c" + gridCol + ",rs" + rowSpan + ",cs" + colSpan + "]";
    }
}

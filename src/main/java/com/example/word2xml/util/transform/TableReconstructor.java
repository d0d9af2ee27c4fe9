package com.example.word2xml.util.transform;

import com.example.word2xml.util.ConversionContext;
import com.example.word2xml.util.transform.dto.ReconstructedCell;
import com.example.word2xml.util.transform.dto.ReconstructedTable;
import com.example.word2xml.util.wml.dto.DocNode;
import com.example.word2xml.util.wml.dto.NodeType;
import com.example.word2xml.util.wml.dto.VMergeState;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * 表格重建：把稀疏的合并标记（gridSpan / vMerge）换算成每个起点单元格的行跨度和列跨度
 *
 * 说明：
 * - colSpan 来自 gridSpan（默认1）
 * - rowSpan = 1 + 下方同一网格列上连续的 vMerge=continue 单元格数
 * - 续接单元格不输出
 * - gridCol 由规范化阶段预先算好（已计入前面单元格的 gridSpan 和 gridBefore）
 *
 * 校验：每一行被占用的列数（本行起点单元格 + 上方纵向合并延续下来的部分）必须等于声明的列数，
 * 且不能重叠、不能越界。校验失败时丢弃整张表的合并信息，所有源单元格按 1x1 输出。
 * 列数超过 {@link #MAX_COLUMNS} 的同样按校验失败处理
 */
@Slf4j
public final class TableReconstructor {

    /** Word 表格最多 63 列 */
    static final int MAX_COLUMNS = 63;

    private TableReconstructor() {
    }

    // 计算用的临时结构
    private static final class Temp {
        int row;
        int gridCol;
        int colSpan;
        int rowSpan = 1;
        VMergeState vm;
        Temp origin;
        DocNode cell;
    }

    /**
     * 重建一张表格
     *
     * @param table           TABLE 节点
     * @param declaredColumns SET Table:N 域声明的列数；没有声明时传 0
     * @param isHeaderRow     判断是否表头行
     * @param ctx             转换上下文
     * @return 重建结果
     */
    public static ReconstructedTable reconstruct(DocNode table, int declaredColumns,
                                                 Predicate<DocNode> isHeaderRow, ConversionContext ctx) {
        ctx.getReport().incrementTableCount();
        List<Integer> widths = parseWidths(table.attr(DocNode.ATTR_GRID_WIDTHS));

        // 1) 第一遍：读取每个单元格的网格位置
        List<DocNode> sourceRows = new ArrayList<>();
        List<List<Temp>> grid = new ArrayList<>();
        int maxEnd = 0;
        for (DocNode row : table.getChildren()) {
            if (!row.is(NodeType.ROW)) {
                continue;
            }
            List<Temp> temps = new ArrayList<>();
            for (DocNode cell : row.getChildren()) {
                Temp t = new Temp();
                t.row = grid.size();
                // 超出上限的位置和跨度截断到 MAX_COLUMNS + 1，校验时必然越界
                t.gridCol = Math.max(0, Math.min(MAX_COLUMNS + 1, cell.intAttr(DocNode.ATTR_GRID_COL, 0)));
                t.colSpan = Math.max(1, Math.min(MAX_COLUMNS + 1, cell.intAttr(DocNode.ATTR_GRID_SPAN, 1)));
                t.vm = vmerge(cell);
                t.cell = cell;
                temps.add(t);
                maxEnd = Math.max(maxEnd, t.gridCol + t.colSpan);
            }
            sourceRows.add(row);
            grid.add(temps);
        }

        int columnCount;
        if (declaredColumns > 0) {
            columnCount = declaredColumns;
        } else if (!widths.isEmpty()) {
            columnCount = widths.size();
        } else {
            columnCount = maxEnd;
        }

        // 2) 第二遍：续接单元格找到上方起点，起点的 rowSpan 累加
        for (int r = 1; r < grid.size(); r++) {
            for (Temp t : grid.get(r)) {
                if (t.vm != VMergeState.CONTINUE) {
                    continue;
                }
                Temp above = findByGridCol(grid.get(r - 1), t.gridCol);
                Temp origin = null;
                if (above != null) {
                    origin = above.vm == VMergeState.CONTINUE ? above.origin : above;
                }
                // 起点必须在同一起始列，且本行紧接在起点覆盖范围之后
                if (origin != null && origin.gridCol == t.gridCol && origin.row + origin.rowSpan == r) {
                    t.origin = origin;
                    origin.rowSpan++;
                }
            }
        }
        for (List<Temp> temps : grid) {
            for (Temp t : temps) {
                if (t.vm == VMergeState.CONTINUE && t.origin == null) {
                    ctx.anomaly("第 " + (t.row + 1) + " 行第 " + (t.gridCol + 1) + " 列的纵向合并没有起点，按独立单元格处理");
                }
            }
        }

        int headerRows = 0;
        while (headerRows < sourceRows.size() && isHeaderRow.test(sourceRows.get(headerRows))) {
            headerRows++;
        }

        List<List<ReconstructedCell>> rows = new ArrayList<>();
        for (List<Temp> temps : grid) {
            List<ReconstructedCell> cells = new ArrayList<>();
            for (Temp t : temps) {
                if (t.origin == null) {
                    cells.add(new ReconstructedCell(t.row, t.gridCol, t.rowSpan, t.colSpan, t.cell));
                }
            }
            rows.add(cells);
        }

        // 3) 校验每行占用
        String problem = validate(rows, columnCount);
        if (problem == null) {
            return new ReconstructedTable(columnCount, widths, rows, coverHeaderMerges(rows, headerRows), false);
        }

        log.warn("[{}] 表格合并信息不一致（{}），回退为无合并表格", ctx.getDocumentName(), problem);
        ctx.getReport().incrementMergeFallbackCount();
        ctx.anomaly("表格合并回退: " + problem);
        List<List<ReconstructedCell>> flat = new ArrayList<>();
        for (List<Temp> temps : grid) {
            List<ReconstructedCell> cells = new ArrayList<>();
            for (Temp t : temps) {
                cells.add(new ReconstructedCell(t.row, t.gridCol, 1, 1, t.cell));
            }
            flat.add(cells);
        }
        return new ReconstructedTable(Math.min(columnCount, MAX_COLUMNS), widths, flat, headerRows, true);
    }

    /**
     * 校验网格占用
     *
     * @return 问题描述；没有问题返回 null
     */
    static String validate(List<List<ReconstructedCell>> rows, int columnCount) {
        if (columnCount > MAX_COLUMNS) {
            return "列数 " + columnCount + " 超过上限 " + MAX_COLUMNS;
        }
        boolean[][] occupied = new boolean[rows.size()][columnCount];
        for (int r = 0; r < rows.size(); r++) {
            for (ReconstructedCell cell : rows.get(r)) {
                int lastRow = r + cell.getRowSpan() - 1;
                for (int rr = r; rr <= lastRow && rr < rows.size(); rr++) {
                    for (int c = cell.getGridCol(); c < cell.getGridCol() + cell.getColSpan(); c++) {
                        if (c >= columnCount) {
                            return "第 " + (rr + 1) + " 行超出声明的 " + columnCount + " 列";
                        }
                        if (occupied[rr][c]) {
                            return "第 " + (rr + 1) + " 行第 " + (c + 1) + " 列被重复占用";
                        }
                        occupied[rr][c] = true;
                    }
                }
            }
        }
        for (int r = 0; r < rows.size(); r++) {
            int count = 0;
            for (boolean b : occupied[r]) {
                if (b) {
                    count++;
                }
            }
            if (count != columnCount) {
                return "第 " + (r + 1) + " 行占用 " + count + " 列，声明 " + columnCount + " 列";
            }
        }
        return null;
    }

    /**
     * 表头单元格向下合并到表体时，表头扩展到合并结束的那一行
     */
    static int coverHeaderMerges(List<List<ReconstructedCell>> rows, int headerRows) {
        int covered = headerRows;
        for (int r = 0; r < covered; r++) {
            for (ReconstructedCell cell : rows.get(r)) {
                covered = Math.max(covered, Math.min(rows.size(), r + cell.getRowSpan()));
            }
        }
        return covered;
    }

    private static Temp findByGridCol(List<Temp> row, int gridCol) {
        for (Temp t : row) {
            if (gridCol >= t.gridCol && gridCol < t.gridCol + t.colSpan) {
                return t;
            }
        }
        return null;
    }

    private static VMergeState vmerge(DocNode cell) {
        String value = cell.attr(DocNode.ATTR_VMERGE);
        if (value == null) {
            return VMergeState.NONE;
        }
        try {
            return VMergeState.valueOf(value);
        } catch (IllegalArgumentException e) {
            return VMergeState.NONE;
        }
    }

    private static List<Integer> parseWidths(String value) {
        List<Integer> widths = new ArrayList<>();
        if (value == null || value.isEmpty()) {
            return widths;
        }
        for (String part : value.split(",")) {
            try {
                widths.add(Integer.parseInt(part.trim()));
            } catch (NumberFormatException e) {
                widths.add(0);
            }
        }
        return widths;
    }
}

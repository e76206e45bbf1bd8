package com.sitescraper.core.service.export;

import com.sitescraper.core.model.ExportFormat;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** .xlsx 시트 1장, CSV 와 같은 열 */
public final class ExcelBundleExporter implements BundleExporter {

    public static final String SHEET_NAME = "Pages";

    /** 엑셀 셀 최대 글자 수 */
    static final int MAX_CELL_CHARS = 32_767;

    @Override public ExportFormat format() { return ExportFormat.EXCEL; }

    @Override
    public void write(List<BundleRow> rows, Path target) throws IOException {
        try (XSSFWorkbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet(SHEET_NAME);

            CellStyle bold = wb.createCellStyle();
            Font f = wb.createFont();
            f.setBold(true);
            bold.setFont(f);

            Row header = sheet.createRow(0);
            for (int i = 0; i < BundleRow.COLUMNS.size(); i++) {
                Cell c = header.createCell(i);
                c.setCellValue(BundleRow.COLUMNS.get(i));
                c.setCellStyle(bold);
            }
            int rowNo = 1;
            for (BundleRow r : rows) {
                Row row = sheet.createRow(rowNo++);
                List<String> cells = r.cells();
                for (int i = 0; i < cells.size(); i++) {
                    String v = cells.get(i);
                    row.createCell(i).setCellValue(v.length() > MAX_CELL_CHARS ? v.substring(0, MAX_CELL_CHARS) : v);
                }
            }
            sheet.createFreezePane(0, 1);

            try (OutputStream out = Files.newOutputStream(target)) {
                wb.write(out);
            }
        }
    }
}

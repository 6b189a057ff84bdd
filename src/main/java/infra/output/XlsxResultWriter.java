package infra.output;

import domain.model.AnalysisWarning;
import domain.model.SqlStatementResult;
import domain.output.ResultWriter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>result: one row per statement (SUCCESS/FAILED)</li>
 *   <li>warnings: non-fatal warnings (standard codes)</li>
 * </ul>
 */
public final class XlsxResultWriter implements ResultWriter {

    static final String SHEET_RESULT = "result";
    static final String SHEET_WARNINGS = "warnings";

    private static final String[] RESULT_HEADER =
            {"file", "index", "status", "kind", "statements", "elapsedMs", "message"};
    private static final String[] WARNING_HEADER =
            {"code", "file", "index", "message", "detail"};

    private static void writeResultSheet(Workbook wb, List<SqlStatementResult> results) {
        Sheet sh = wb.createSheet(SHEET_RESULT);
        int r = 0;
        writeHeader(sh.createRow(r++), RESULT_HEADER);

        for (SqlStatementResult it : results) {
            Row row = sh.createRow(r++);
            row.createCell(0).setCellValue(nullToEmpty(it.getFile()));
            row.createCell(1).setCellValue(it.getIndex());
            row.createCell(2).setCellValue(nullToEmpty(it.getStatus()));
            row.createCell(3).setCellValue(nullToEmpty(it.getKind()));
            row.createCell(4).setCellValue(it.getStatementCount());
            row.createCell(5).setCellValue(it.getElapsedMs());
            row.createCell(6).setCellValue(nullToEmpty(it.getMessage()));
        }
    }

    private static void writeWarningsSheet(Workbook wb, List<AnalysisWarning> warnings) {
        Sheet sh = wb.createSheet(SHEET_WARNINGS);
        int r = 0;
        writeHeader(sh.createRow(r++), WARNING_HEADER);

        for (AnalysisWarning w : warnings) {
            Row row = sh.createRow(r++);
            row.createCell(0).setCellValue(w.getCode() == null ? "" : w.getCode().name());
            row.createCell(1).setCellValue(nullToEmpty(w.getFile()));
            row.createCell(2).setCellValue(w.getStatementIndex());
            row.createCell(3).setCellValue(nullToEmpty(w.getMessage()));
            row.createCell(4).setCellValue(nullToEmpty(w.getDetail()));
        }
    }

    private static void writeHeader(Row header, String[] names) {
        for (int c = 0; c < names.length; c++) {
            header.createCell(c).setCellValue(names[c]);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    @Override
    public void write(Path resultXlsx, List<SqlStatementResult> results, List<AnalysisWarning> warnings) {
        if (resultXlsx == null) throw new IllegalArgumentException("resultXlsx is null");
        if (results == null) throw new IllegalArgumentException("results is null");
        if (warnings == null) throw new IllegalArgumentException("warnings is null");

        try {
            Path parent = resultXlsx.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create resultXlsx parent dir: " + resultXlsx, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeResultSheet(wb, results);
            writeWarningsSheet(wb, warnings);

            try (OutputStream os = Files.newOutputStream(resultXlsx)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + resultXlsx, e);
        }
    }
}

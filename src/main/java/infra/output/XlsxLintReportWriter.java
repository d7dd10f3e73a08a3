package infra.output;

import domain.lint.LintFix;
import domain.lint.LintResult;
import domain.model.ReflowEvent;
import domain.output.LintReportWriter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>results: one row per fix, located at the reported anchor</li>
 *   <li>events: reflow diagnostics (standard codes)</li>
 * </ul>
 */
public final class XlsxLintReportWriter implements LintReportWriter {

    private static final Logger log = LoggerFactory.getLogger(XlsxLintReportWriter.class);

    private static void writeResultsSheet(Workbook wb, List<LintResult> results) {
        Sheet sh = wb.createSheet("results");
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue("lineNo");
        header.createCell(1)
                .setCellValue("linePos");
        header.createCell(2)
                .setCellValue("editType");
        header.createCell(3)
                .setCellValue("anchorType");
        header.createCell(4)
                .setCellValue("description");
        header.createCell(5)
                .setCellValue("edit");

        for (LintResult it : results) {
            LintFix fix = it.getFixes().isEmpty() ? null : it.getFixes().get(0);
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(it.getLineNo());
            row.createCell(1)
                    .setCellValue(it.getLinePos());
            row.createCell(2)
                    .setCellValue(fix == null ? "" : fix.getEditType()
                            .name());
            row.createCell(3)
                    .setCellValue(it.getAnchor() == null ? "" : nullToEmpty(it.getAnchor()
                            .getType()));
            row.createCell(4)
                    .setCellValue(nullToEmpty(it.getDescription()));
            row.createCell(5)
                    .setCellValue(fix == null ? "" : escape(fix.getEditRaw()));
        }
    }

    private static void writeEventsSheet(Workbook wb, List<ReflowEvent> events) {
        Sheet sh = wb.createSheet("events");
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue("code");
        header.createCell(1)
                .setCellValue("lineNo");
        header.createCell(2)
                .setCellValue("linePos");
        header.createCell(3)
                .setCellValue("message");
        header.createCell(4)
                .setCellValue("detail");

        for (ReflowEvent e : events) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(e.getCode() == null ? "" : e.getCode()
                            .name());
            row.createCell(1)
                    .setCellValue(e.getLineNo());
            row.createCell(2)
                    .setCellValue(e.getLinePos());
            row.createCell(3)
                    .setCellValue(nullToEmpty(e.getMessage()));
            row.createCell(4)
                    .setCellValue(nullToEmpty(e.getDetail()));
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    // Keeps whitespace edits readable in a single cell.
    private static String escape(String s) {
        return nullToEmpty(s).replace("\n", "\\n")
                .replace("\t", "\\t");
    }

    @Override
    public void write(Path reportFile, List<LintResult> results, List<ReflowEvent> events) {
        if (reportFile == null) throw new IllegalArgumentException("reportFile is null");
        if (results == null) throw new IllegalArgumentException("results is null");
        if (events == null) throw new IllegalArgumentException("events is null");

        try {
            Path parent = reportFile.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create report parent dir: " + reportFile, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeResultsSheet(wb, results);
            writeEventsSheet(wb, events);

            try (OutputStream os = Files.newOutputStream(reportFile)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + reportFile, e);
        }
        log.info("Lint report written: {} (results={}, events={})", reportFile, results.size(), events.size());
    }
}

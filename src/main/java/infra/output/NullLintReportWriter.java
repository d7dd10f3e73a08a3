package infra.output;

import domain.lint.LintResult;
import domain.model.ReflowEvent;
import domain.output.LintReportWriter;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation (feature toggle).
 */
public final class NullLintReportWriter implements LintReportWriter {
    @Override
    public void write(Path reportFile, List<LintResult> results, List<ReflowEvent> events) {
        // intentionally no-op
    }
}

package domain.output;

import domain.lint.LintResult;
import domain.model.ReflowEvent;

import java.nio.file.Path;
import java.util.List;

/** Saves the results and diagnostics of a reflow run. */
public interface LintReportWriter {

    void write(Path reportFile, List<LintResult> results, List<ReflowEvent> events);
}

package com.flamingo.ai.stylecheck.cli;

import com.flamingo.ai.stylecheck.domain.enums.RuleCategory;
import com.flamingo.ai.stylecheck.exception.DocumentProcessingException;
import com.flamingo.ai.stylecheck.service.document.CorrectionReportWriter;
import com.flamingo.ai.stylecheck.service.pipeline.DocumentCorrectionReport;
import com.flamingo.ai.stylecheck.service.pipeline.DocumentPipeline;
import com.flamingo.ai.stylecheck.service.pipeline.ProgressPublisher;
import com.flamingo.ai.stylecheck.service.pipeline.StyleGuideSummary;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

/**
 * Command-line entry point: ingest a style guide (or load a saved one), optionally save it, and
 * correct a document.
 *
 * <pre>
 * --style-guide=guide.pdf | --load-index=dir   [--save-index=dir]
 * --document=report.docx  [--output-dir=dir]
 * </pre>
 *
 * <p>Writes {@value #CORRECTED_FILE} and {@value #ANALYSIS_FILE} to the output directory.
 */
@Component
@ConditionalOnProperty(prefix = "style.cli", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class StyleCheckRunner implements ApplicationRunner {

  static final String CORRECTED_FILE = "corrected_document.docx";
  static final String ANALYSIS_FILE = "document_analysis.docx";

  private final DocumentPipeline pipeline;
  private final CorrectionReportWriter reportWriter;
  private final ProgressPublisher progressPublisher;

  @Override
  public void run(ApplicationArguments args) {
    String styleGuide = option(args, "style-guide");
    String loadIndex = option(args, "load-index");
    String document = option(args, "document");
    if (styleGuide == null && loadIndex == null) {
      log.info(
          "Nothing to do. Usage: --style-guide=<file> | --load-index=<dir> [--save-index=<dir>]"
              + " [--document=<file>] [--output-dir=<dir>]");
      return;
    }

    Disposable progressLog =
        progressPublisher
            .events()
            .subscribe(
                event ->
                    log.info(
                        "[{}:{}] {}/{} {}",
                        event.stage(),
                        event.phase(),
                        event.current(),
                        event.total(),
                        event.message()));
    try {
      StyleGuideSummary summary =
          styleGuide != null
              ? pipeline.ingestStyleGuide(read(Path.of(styleGuide)), fileName(styleGuide))
              : pipeline.restoreSession(Path.of(loadIndex));
      logSummary(summary);

      String saveIndex = option(args, "save-index");
      if (saveIndex != null) {
        pipeline.saveSession(Path.of(saveIndex));
      }

      if (document != null) {
        DocumentCorrectionReport report =
            pipeline.correctDocument(read(Path.of(document)), fileName(document));
        String outputDir = option(args, "output-dir");
        writeOutputs(report, Path.of(outputDir != null ? outputDir : "."));
      }
    } finally {
      progressLog.dispose();
    }
  }

  private void writeOutputs(DocumentCorrectionReport report, Path outputDir) {
    Path corrected = outputDir.resolve(CORRECTED_FILE);
    Path analysis = outputDir.resolve(ANALYSIS_FILE);
    try {
      Files.createDirectories(outputDir);
      Files.write(corrected, reportWriter.writeCorrectedDocument(report));
      Files.write(analysis, reportWriter.writeAnalysisDocument(report));
    } catch (IOException e) {
      throw new DocumentProcessingException(
          outputDir.toString(), "Failed to write results: " + e.getMessage(), e);
    }
    log.info(
        "Wrote {} and {} ({} changes in {} of {} chunks)",
        corrected,
        analysis,
        report.stats().totalChanges(),
        report.stats().changedChunks(),
        report.stats().chunks());
  }

  private void logSummary(StyleGuideSummary summary) {
    log.info(
        "Style guide {}: {} chunks, {} rules",
        summary.sourceName(),
        summary.chunksIndexed(),
        summary.rulesIndexed());
    for (Map.Entry<RuleCategory, Integer> entry : summary.rulesByCategory().entrySet()) {
      if (entry.getValue() > 0) {
        log.info("  {}: {} rules", entry.getKey().getDisplayName(), entry.getValue());
      }
    }
  }

  private static String option(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    return values == null || values.isEmpty() ? null : values.get(0);
  }

  private static byte[] read(Path path) {
    try {
      return Files.readAllBytes(path);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          path.toString(), "Failed to read " + path + ": " + e.getMessage(), e);
    }
  }

  private static String fileName(String path) {
    return Path.of(path).getFileName().toString();
  }
}

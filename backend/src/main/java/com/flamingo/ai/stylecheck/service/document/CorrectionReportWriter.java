package com.flamingo.ai.stylecheck.service.document;

import com.flamingo.ai.stylecheck.domain.model.CorrectionMatch;
import com.flamingo.ai.stylecheck.domain.model.CorrectionResult;
import com.flamingo.ai.stylecheck.domain.model.StyleChunk;
import com.flamingo.ai.stylecheck.domain.model.StyleGuideEntry;
import com.flamingo.ai.stylecheck.domain.model.StyleRule;
import com.flamingo.ai.stylecheck.service.correction.ChangeMarkers;
import com.flamingo.ai.stylecheck.service.pipeline.DocumentCorrectionReport;
import com.flamingo.ai.stylecheck.service.pipeline.DocumentCorrectionReport.ParagraphResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Renders a {@link DocumentCorrectionReport} as two Word documents: the corrected text with change
 * markers removed, and an analysis listing every changed chunk with the rules behind it.
 */
@Component
@RequiredArgsConstructor
public class CorrectionReportWriter {

  private final DocxDocumentWriter docxWriter;

  public byte[] writeCorrectedDocument(DocumentCorrectionReport report) {
    return docxWriter.write(correctedParagraphs(report));
  }

  public byte[] writeAnalysisDocument(DocumentCorrectionReport report) {
    return docxWriter.write(analysisParagraphs(report));
  }

  List<DocxParagraph> correctedParagraphs(DocumentCorrectionReport report) {
    List<DocxParagraph> paragraphs = new ArrayList<>();
    for (ParagraphResult paragraph : report.paragraphs()) {
      paragraphs.add(DocxParagraph.body(ChangeMarkers.strip(paragraph.correctedText())));
    }
    return paragraphs;
  }

  List<DocxParagraph> analysisParagraphs(DocumentCorrectionReport report) {
    List<DocxParagraph> paragraphs = new ArrayList<>();
    paragraphs.add(DocxParagraph.heading("Style Analysis Report", 1));
    paragraphs.add(DocxParagraph.body("Document: " + report.documentName()));
    paragraphs.add(DocxParagraph.body("Style guide: " + report.styleGuideName()));
    DocumentCorrectionReport.Stats stats = report.stats();
    paragraphs.add(
        DocxParagraph.body(
            String.format(
                Locale.ROOT,
                "%d of %d chunks changed, %d changes in total (%d from the style guide index)",
                stats.changedChunks(),
                stats.chunks(),
                stats.totalChanges(),
                stats.retrievalChanges())));

    int changeNumber = 0;
    for (CorrectionResult result : report.results()) {
      if (!result.hasChanges()) {
        continue;
      }
      changeNumber++;
      paragraphs.add(DocxParagraph.heading("Change " + changeNumber, 2));
      paragraphs.add(DocxParagraph.body("Original: " + result.originalText()));
      paragraphs.add(DocxParagraph.body("Corrected: " + result.correctedText()));
      for (String change : result.changes()) {
        paragraphs.add(DocxParagraph.body("- " + change));
      }
      for (CorrectionMatch match : result.appliedRules()) {
        paragraphs.add(DocxParagraph.heading("Applied rule", 3));
        paragraphs.addAll(describeMatch(match));
      }
    }
    if (changeNumber == 0) {
      paragraphs.add(DocxParagraph.body("No changes were needed."));
    }
    return paragraphs;
  }

  private List<DocxParagraph> describeMatch(CorrectionMatch match) {
    List<DocxParagraph> lines = new ArrayList<>();
    StyleGuideEntry entry = match.entry();
    if (entry instanceof StyleRule rule) {
      lines.add(DocxParagraph.body("Rule type: " + rule.getType()));
      lines.add(DocxParagraph.body("Category: " + rule.getCategory().getDisplayName()));
    } else if (entry instanceof StyleChunk chunk) {
      lines.add(DocxParagraph.body("Rule type: " + chunk.getRuleType()));
      lines.add(DocxParagraph.body("Section: " + chunk.getSection()));
    }
    lines.add(DocxParagraph.body("Rule: " + entry.label()));
    if (!entry.getExamples().isEmpty()) {
      lines.add(DocxParagraph.body("Examples: " + String.join("; ", entry.getExamples())));
    }
    lines.add(
        DocxParagraph.body(String.format(Locale.ROOT, "Confidence: %.2f", match.confidence())));
    return lines;
  }
}

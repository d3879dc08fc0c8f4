package com.flamingo.ai.stylecheck.service.document;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.stylecheck.domain.enums.RuleCategory;
import com.flamingo.ai.stylecheck.domain.enums.RuleType;
import com.flamingo.ai.stylecheck.domain.model.CorrectionMatch;
import com.flamingo.ai.stylecheck.domain.model.CorrectionResult;
import com.flamingo.ai.stylecheck.domain.model.StyleChunk;
import com.flamingo.ai.stylecheck.domain.model.StyleRule;
import com.flamingo.ai.stylecheck.service.pipeline.DocumentCorrectionReport;
import com.flamingo.ai.stylecheck.service.pipeline.DocumentCorrectionReport.ParagraphResult;
import com.flamingo.ai.stylecheck.service.pipeline.DocumentCorrectionReport.Stats;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CorrectionReportWriter Tests")
class CorrectionReportWriterTest {

  private final CorrectionReportWriter writer =
      new CorrectionReportWriter(new DocxDocumentWriter());

  private static DocumentCorrectionReport changedReport() {
    StyleRule rule =
        StyleRule.builder()
            .pattern("patient")
            .replacement("Subject")
            .type(RuleType.DIRECT)
            .category(RuleCategory.DOMAIN)
            .description("Patient should be Subject.")
            .examples(List.of("Subject"))
            .build();
    StyleChunk chunk =
        StyleChunk.builder()
            .content("Write the sponsor name in title case.")
            .ruleType("formatting")
            .section("Names")
            .build();
    CorrectionResult changed =
        new CorrectionResult(
            "The patient was enrolled.",
            "The <change confidence=0.96>Subject</change> was enrolled.",
            List.of(
                new CorrectionMatch(rule, 0.04, 0.96, List.of("Changed 'patient' to 'Subject'")),
                new CorrectionMatch(chunk, 0.5, 0.5, List.of())),
            List.of("Changed 'patient' to 'Subject'"));
    CorrectionResult unchanged = CorrectionResult.unchanged("No change here.");

    return new DocumentCorrectionReport(
        "csr.docx",
        "guide.pdf",
        List.of(
            new ParagraphResult(0, List.of(changed, unchanged)),
            new ParagraphResult(1, List.of(CorrectionResult.unchanged("Second paragraph.")))),
        new Stats(2, 3, 1, 1, 1));
  }

  private static List<String> texts(List<DocxParagraph> paragraphs) {
    return paragraphs.stream().map(DocxParagraph::text).toList();
  }

  @Test
  @DisplayName("should write corrected paragraphs without change markers")
  void shouldWriteCorrectedParagraphs() {
    List<DocxParagraph> paragraphs = writer.correctedParagraphs(changedReport());

    assertThat(texts(paragraphs))
        .containsExactly("The Subject was enrolled. No change here.", "Second paragraph.");
    assertThat(paragraphs).noneMatch(DocxParagraph::isHeading);
  }

  @Test
  @DisplayName("should describe each changed chunk and the rules behind it")
  void shouldDescribeChanges() {
    List<DocxParagraph> paragraphs = writer.analysisParagraphs(changedReport());

    assertThat(paragraphs.get(0)).isEqualTo(DocxParagraph.heading("Style Analysis Report", 1));
    assertThat(texts(paragraphs))
        .containsSubsequence(
            "Document: csr.docx",
            "Style guide: guide.pdf",
            "1 of 3 chunks changed, 1 changes in total (1 from the style guide index)",
            "Change 1",
            "Original: The patient was enrolled.",
            "Corrected: The <change confidence=0.96>Subject</change> was enrolled.",
            "- Changed 'patient' to 'Subject'",
            "Applied rule",
            "Rule type: DIRECT",
            "Category: Domain",
            "Rule: Patient should be Subject.",
            "Examples: Subject",
            "Confidence: 0.96",
            "Applied rule",
            "Rule type: formatting",
            "Section: Names",
            "Rule: Names: Write the sponsor name in title case.",
            "Confidence: 0.50")
        .doesNotContain("Change 2", "No changes were needed.");
  }

  @Test
  @DisplayName("should state that nothing changed when every chunk is unchanged")
  void shouldReportNoChanges() {
    DocumentCorrectionReport report =
        new DocumentCorrectionReport(
            "csr.txt",
            "guide.txt",
            List.of(new ParagraphResult(0, List.of(CorrectionResult.unchanged("Fine.")))),
            new Stats(1, 1, 0, 0, 0));

    List<String> lines = texts(writer.analysisParagraphs(report));

    assertThat(lines)
        .contains("0 of 1 chunks changed, 0 changes in total (0 from the style guide index)");
    assertThat(lines).last().isEqualTo("No changes were needed.");
  }

  @Test
  @DisplayName("should produce Word documents that open with the expected text")
  void shouldWriteDocxOutputs() throws IOException {
    DocumentCorrectionReport report = changedReport();

    try (XWPFDocument corrected =
            new XWPFDocument(new ByteArrayInputStream(writer.writeCorrectedDocument(report)));
        XWPFDocument analysis =
            new XWPFDocument(new ByteArrayInputStream(writer.writeAnalysisDocument(report)))) {
      assertThat(corrected.getParagraphs())
          .extracting(XWPFParagraph::getText)
          .containsExactly("The Subject was enrolled. No change here.", "Second paragraph.");
      assertThat(analysis.getParagraphs().get(0).getText()).isEqualTo("Style Analysis Report");
    }
  }
}

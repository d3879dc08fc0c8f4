package com.flamingo.ai.stylecheck.service.pipeline;

import com.flamingo.ai.stylecheck.config.StyleCheckConfig;
import com.flamingo.ai.stylecheck.domain.enums.RuleCategory;
import com.flamingo.ai.stylecheck.domain.model.CorrectionResult;
import com.flamingo.ai.stylecheck.domain.model.DocumentSection;
import com.flamingo.ai.stylecheck.domain.model.StyleChunk;
import com.flamingo.ai.stylecheck.domain.model.StyleRule;
import com.flamingo.ai.stylecheck.exception.StyleGuideNotLoadedException;
import com.flamingo.ai.stylecheck.service.correction.ChangeMarkers;
import com.flamingo.ai.stylecheck.service.correction.CorrectionEngine;
import com.flamingo.ai.stylecheck.service.document.DocumentFormat;
import com.flamingo.ai.stylecheck.service.document.DocumentTextExtractorRouter;
import com.flamingo.ai.stylecheck.service.index.EmbeddingIndexFactory;
import com.flamingo.ai.stylecheck.service.index.StyleChunkIndex;
import com.flamingo.ai.stylecheck.service.index.StyleGuideSession;
import com.flamingo.ai.stylecheck.service.index.StyleGuideSnapshotStore;
import com.flamingo.ai.stylecheck.service.index.StyleRuleIndex;
import com.flamingo.ai.stylecheck.service.pipeline.DocumentCorrectionReport.ParagraphResult;
import com.flamingo.ai.stylecheck.service.rule.RuleExtractor;
import com.flamingo.ai.stylecheck.service.rule.StyleChunkAnnotator;
import com.flamingo.ai.stylecheck.service.segment.TextSegmenter;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Orchestrates style-guide ingestion and document correction.
 *
 * <p>Ingestion builds a new {@link StyleGuideSession}: sections are chunked, annotated and
 * embedded into the chunk index, and rules extracted from the whole text go to the rule index.
 * The session is published only once both indexes are complete, so a correction never sees a
 * half-built index. Correction splits the target text into paragraphs and chunks, corrects each
 * chunk and reassembles the results in input order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentPipeline {

  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\r?\\n\\s*\\n");

  private final DocumentTextExtractorRouter extractorRouter;
  private final TextSegmenter segmenter;
  private final RuleExtractor ruleExtractor;
  private final StyleChunkAnnotator chunkAnnotator;
  private final EmbeddingIndexFactory indexFactory;
  private final StyleGuideSnapshotStore snapshotStore;
  private final CorrectionEngine correctionEngine;
  private final ChunkCorrectionWorker correctionWorker;
  private final ProgressPublisher progressPublisher;
  private final StyleCheckConfig config;
  private final MeterRegistry meterRegistry;

  private final AtomicReference<StyleGuideSession> currentSession = new AtomicReference<>();

  /** The most recently ingested style guide, if any. */
  public Optional<StyleGuideSession> currentSession() {
    return Optional.ofNullable(currentSession.get());
  }

  /**
   * Reads a style-guide file and indexes it.
   *
   * @param content file bytes
   * @param fileName file name; its extension selects the reader
   * @return summary of what was indexed
   */
  @Timed(value = "style.pipeline.ingest", description = "Time to ingest a style guide")
  public StyleGuideSummary ingestStyleGuide(byte[] content, String fileName) {
    DocumentFormat format = DocumentFormat.fromFileName(fileName);
    log.info("Ingesting style guide {} ({}, {} bytes)", fileName, format, content.length);
    progressPublisher.publish(
        ProgressEvent.STYLE_GUIDE, ProgressEvent.READING, 0, 0, "Reading " + fileName);

    String text =
        extractorRouter
            .route(format)
            .extractText(
                content,
                fileName,
                (page, totalPages) ->
                    progressPublisher.publish(
                        ProgressEvent.STYLE_GUIDE,
                        ProgressEvent.READING,
                        page,
                        totalPages,
                        "Read page " + page + " of " + totalPages));
    return ingestStyleGuideText(text, fileName);
  }

  /**
   * Indexes style-guide text that has already been extracted.
   *
   * @param text guide text; blank text produces an empty session
   * @param sourceName label stored in the session
   */
  @Timed(value = "style.pipeline.ingestText", description = "Time to index style-guide text")
  public StyleGuideSummary ingestStyleGuideText(String text, String sourceName) {
    if (text == null || text.isBlank()) {
      log.warn("No text extracted from style guide {}, nothing will be indexed", sourceName);
      text = "";
    }

    List<DocumentSection> sections = segmenter.extractSections(text);
    StyleChunkIndex chunkIndex = indexFactory.newChunkIndex();
    int maxChunkSize = config.getChunking().getMaxChunkSize();
    int minLength = config.getChunking().getMinStyleChunkLength();

    for (int i = 0; i < sections.size(); i++) {
      DocumentSection section = sections.get(i);
      progressPublisher.publish(
          ProgressEvent.STYLE_GUIDE,
          ProgressEvent.PROCESSING,
          i + 1,
          sections.size(),
          "Processing section: " + (section.title().isEmpty() ? "(untitled)" : section.title()));

      for (String content : segmenter.segmentIntoChunks(section.body(), maxChunkSize)) {
        if (content.length() < minLength) {
          log.debug("Skipping short style-guide chunk ({} chars)", content.length());
          continue;
        }
        StyleChunk chunk =
            StyleChunk.builder()
                .content(content)
                .ruleType(chunkAnnotator.identifyRuleType(content, section.title()))
                .section(section.title())
                .examples(chunkAnnotator.extractExamples(content))
                .metadata(Map.of("sectionIndex", i, "source", sourceName))
                .build();
        chunkIndex.addChunk(chunk);
      }
    }

    List<StyleRule> rules = ruleExtractor.extractRules(text);
    progressPublisher.publish(
        ProgressEvent.STYLE_GUIDE,
        ProgressEvent.INDEXING,
        0,
        rules.size(),
        "Indexing " + rules.size() + " rules");
    StyleRuleIndex ruleIndex = indexFactory.newRuleIndex();
    ruleIndex.addRules(rules);

    StyleGuideSession session =
        new StyleGuideSession(sourceName, ruleIndex, chunkIndex, Instant.now());
    currentSession.set(session);
    meterRegistry.counter("style.pipeline.guides.ingested").increment();
    log.info(
        "Style guide {} ready: {} sections, {} chunks, {} rules",
        sourceName,
        sections.size(),
        chunkIndex.size(),
        ruleIndex.size());
    progressPublisher.publish(
        ProgressEvent.STYLE_GUIDE,
        ProgressEvent.COMPLETE,
        sections.size(),
        sections.size(),
        "Style guide processed");
    return summarize(session, sections.size());
  }

  /**
   * Replaces the current session with one built from a prepared rule set, without chunks.
   *
   * @param rules hand-written or previously extracted rules
   * @param sourceName label stored in the session
   */
  public StyleGuideSummary ingestRules(List<StyleRule> rules, String sourceName) {
    StyleRuleIndex ruleIndex = indexFactory.newRuleIndex();
    ruleIndex.addRules(rules);
    StyleGuideSession session =
        new StyleGuideSession(sourceName, ruleIndex, indexFactory.newChunkIndex(), Instant.now());
    currentSession.set(session);
    log.info("Loaded {} rules from {}", ruleIndex.size(), sourceName);
    return summarize(session, 0);
  }

  /** Makes a session loaded from a snapshot directory current. */
  public StyleGuideSummary restoreSession(Path directory) {
    StyleGuideSession session = snapshotStore.load(directory);
    currentSession.set(session);
    return summarize(session, 0);
  }

  /**
   * Saves the current session to a snapshot directory.
   *
   * @throws StyleGuideNotLoadedException if no style guide has been ingested
   */
  public Path saveSession(Path directory) {
    return snapshotStore.save(requireSession(), directory);
  }

  /**
   * Corrects a target document against the current style guide.
   *
   * @param content file bytes
   * @param fileName file name; its extension selects the reader
   * @throws StyleGuideNotLoadedException if no style guide has been ingested
   */
  @Timed(value = "style.pipeline.correct", description = "Time to correct a document")
  public DocumentCorrectionReport correctDocument(byte[] content, String fileName) {
    DocumentFormat format = DocumentFormat.fromFileName(fileName);
    StyleGuideSession session = requireSession();
    log.info("Correcting {} ({}, {} bytes)", fileName, format, content.length);
    progressPublisher.publish(
        ProgressEvent.DOCUMENT, ProgressEvent.READING, 0, 0, "Reading " + fileName);

    String text =
        extractorRouter
            .route(format)
            .extractText(
                content,
                fileName,
                (page, totalPages) ->
                    progressPublisher.publish(
                        ProgressEvent.DOCUMENT,
                        ProgressEvent.READING,
                        page,
                        totalPages,
                        "Read page " + page + " of " + totalPages));
    if (text.isBlank()) {
      log.warn("No text extracted from {}, nothing to correct", fileName);
    }
    return correct(text, fileName, session);
  }

  /**
   * Corrects plain text against the current style guide.
   *
   * @throws StyleGuideNotLoadedException if no style guide has been ingested
   */
  @Timed(value = "style.pipeline.correctText", description = "Time to correct text")
  public DocumentCorrectionReport correctText(String text, String documentName) {
    return correct(text == null ? "" : text, documentName, requireSession());
  }

  private StyleGuideSession requireSession() {
    StyleGuideSession session = currentSession.get();
    if (session == null) {
      throw new StyleGuideNotLoadedException();
    }
    return session;
  }

  private DocumentCorrectionReport correct(
      String text, String documentName, StyleGuideSession session) {
    List<List<String>> paragraphChunks = new ArrayList<>();
    int maxChunkSize = config.getChunking().getMaxChunkSize();
    for (String paragraph : PARAGRAPH_BREAK.split(text)) {
      List<String> chunks = segmenter.segmentIntoChunks(paragraph, maxChunkSize);
      if (!chunks.isEmpty()) {
        paragraphChunks.add(chunks);
      }
    }
    int totalChunks = paragraphChunks.stream().mapToInt(List::size).sum();
    boolean parallel = config.getCorrection().isParallel();
    log.info(
        "{} split into {} paragraphs, {} chunks (parallel={})",
        documentName,
        paragraphChunks.size(),
        totalChunks,
        parallel);

    List<String> allChunks = paragraphChunks.stream().flatMap(List::stream).toList();
    List<CompletableFuture<CorrectionResult>> pending = new ArrayList<>(totalChunks);
    int maxInFlight = Math.max(1, config.getCorrection().getMaxInFlight());
    if (parallel) {
      submitUpTo(allChunks, pending, Math.min(maxInFlight, totalChunks), session);
    }

    List<ParagraphResult> paragraphs = new ArrayList<>();
    int done = 0;
    for (int p = 0; p < paragraphChunks.size(); p++) {
      List<CorrectionResult> results = new ArrayList<>();
      for (String chunk : paragraphChunks.get(p)) {
        CorrectionResult result =
            parallel ? await(pending.get(done)) : correctionEngine.correct(chunk, session);
        results.add(result);
        done++;
        if (parallel) {
          // at most maxInFlight chunks are queued on the executor at any time
          submitUpTo(allChunks, pending, Math.min(done + maxInFlight, totalChunks), session);
        }
        progressPublisher.publish(
            ProgressEvent.DOCUMENT,
            ProgressEvent.PROCESSING,
            done,
            totalChunks,
            "Corrected chunk " + done + " of " + totalChunks);
      }
      paragraphs.add(new ParagraphResult(p, results));
    }

    DocumentCorrectionReport report =
        new DocumentCorrectionReport(
            documentName, session.sourceName(), paragraphs, stats(paragraphs, totalChunks));
    meterRegistry.counter("style.pipeline.documents.corrected").increment();
    log.info(
        "Corrected {}: {} changed chunks, {} changes",
        documentName,
        report.stats().changedChunks(),
        report.stats().totalChanges());
    progressPublisher.publish(
        ProgressEvent.DOCUMENT,
        ProgressEvent.COMPLETE,
        totalChunks,
        totalChunks,
        "Document corrected");
    return report;
  }

  private void submitUpTo(
      List<String> chunks,
      List<CompletableFuture<CorrectionResult>> pending,
      int limit,
      StyleGuideSession session) {
    while (pending.size() < limit) {
      pending.add(correctionWorker.correctAsync(chunks.get(pending.size()), session));
    }
  }

  private static CorrectionResult await(CompletableFuture<CorrectionResult> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException cause) {
        throw cause;
      }
      throw e;
    }
  }

  private static DocumentCorrectionReport.Stats stats(
      List<ParagraphResult> paragraphs, int totalChunks) {
    int changedChunks = 0;
    int totalChanges = 0;
    int retrievalChanges = 0;
    for (ParagraphResult paragraph : paragraphs) {
      for (CorrectionResult result : paragraph.chunks()) {
        if (result.hasChanges()) {
          changedChunks++;
        }
        totalChanges += result.changes().size();
        retrievalChanges += countMarkers(result.correctedText());
      }
    }
    return new DocumentCorrectionReport.Stats(
        paragraphs.size(), totalChunks, changedChunks, totalChanges, retrievalChanges);
  }

  private static int countMarkers(String text) {
    return (int) ChangeMarkers.MARKER.matcher(text).results().count();
  }

  private StyleGuideSummary summarize(StyleGuideSession session, int sections) {
    Map<RuleCategory, Integer> byCategory = new EnumMap<>(RuleCategory.class);
    ruleExtractor
        .categorizeRules(session.ruleIndex().entries())
        .forEach((category, rules) -> byCategory.put(category, rules.size()));
    return new StyleGuideSummary(
        session.sourceName(), sections, session.chunkCount(), session.ruleCount(), byCategory);
  }
}

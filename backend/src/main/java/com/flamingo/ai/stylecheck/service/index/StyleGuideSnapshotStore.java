package com.flamingo.ai.stylecheck.service.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.stylecheck.domain.model.StyleChunk;
import com.flamingo.ai.stylecheck.domain.model.StyleRule;
import com.flamingo.ai.stylecheck.exception.DocumentProcessingException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Saves an ingested style guide to a JSON file and restores it without calling the embedding
 * model again. Entries are restored in their original order, so index positions are unchanged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StyleGuideSnapshotStore {

  public static final String SNAPSHOT_FILE = "style-guide-index.json";

  private final ObjectMapper objectMapper;
  private final EmbeddingIndexFactory indexFactory;

  /** Serialized form of a session. */
  public record Snapshot(
      String sourceName, Instant ingestedAt, List<RuleEntry> rules, List<StyleChunk> chunks) {}

  /** A rule with the vector it was indexed under. */
  public record RuleEntry(StyleRule rule, float[] embedding) {}

  /**
   * Writes the session to {@value #SNAPSHOT_FILE} inside the given directory.
   *
   * @return path of the written file
   */
  public Path save(StyleGuideSession session, Path directory) {
    List<RuleEntry> rules = new ArrayList<>();
    List<StyleRule> ruleEntries = session.ruleIndex().entries();
    for (int i = 0; i < ruleEntries.size(); i++) {
      rules.add(new RuleEntry(ruleEntries.get(i), session.ruleIndex().vectorAt(i)));
    }
    Snapshot snapshot =
        new Snapshot(
            session.sourceName(), session.ingestedAt(), rules, session.chunkIndex().entries());

    Path file = directory.resolve(SNAPSHOT_FILE);
    try {
      Files.createDirectories(directory);
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), snapshot);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          file.toString(), "Failed to save style guide index: " + e.getMessage(), e);
    }
    log.info(
        "Saved style guide '{}' ({} rules, {} chunks) to {}",
        session.sourceName(),
        rules.size(),
        snapshot.chunks().size(),
        file);
    return file;
  }

  /**
   * Reads a snapshot written by {@link #save} and rebuilds both indexes.
   *
   * @param directory directory containing {@value #SNAPSHOT_FILE}
   */
  public StyleGuideSession load(Path directory) {
    Path file = directory.resolve(SNAPSHOT_FILE);
    Snapshot snapshot;
    try {
      snapshot = objectMapper.readValue(file.toFile(), Snapshot.class);
    } catch (IOException e) {
      throw new DocumentProcessingException(
          file.toString(), "Failed to load style guide index: " + e.getMessage(), e);
    }

    StyleRuleIndex ruleIndex = indexFactory.newRuleIndex();
    if (snapshot.rules() != null) {
      for (RuleEntry entry : snapshot.rules()) {
        ruleIndex.addPrecomputed(entry.rule(), entry.embedding());
      }
    }
    StyleChunkIndex chunkIndex = indexFactory.newChunkIndex();
    if (snapshot.chunks() != null) {
      for (StyleChunk chunk : snapshot.chunks()) {
        chunkIndex.addPrecomputed(chunk, chunk.getEmbedding());
      }
    }

    log.info(
        "Loaded style guide '{}' ({} rules, {} chunks) from {}",
        snapshot.sourceName(),
        ruleIndex.size(),
        chunkIndex.size(),
        file);
    Instant ingestedAt = snapshot.ingestedAt() != null ? snapshot.ingestedAt() : Instant.now();
    return new StyleGuideSession(snapshot.sourceName(), ruleIndex, chunkIndex, ingestedAt);
  }
}

package com.flamingo.ai.stylecheck.service.correction;

import com.flamingo.ai.stylecheck.domain.model.CorrectionMatch;
import com.flamingo.ai.stylecheck.domain.model.StyleGuideEntry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Applies retrieved style-guide entries to a chunk.
 *
 * <p>For each match the first case-insensitive, whole-word occurrence of the entry's trigger text
 * is replaced by the entry's replacement wrapped in a {@link ChangeMarkers change marker}.
 * Replacements are applied from the rightmost position to the leftmost, so pending offsets stay
 * valid. A replacement overlapping one already applied is skipped.
 */
@Component
@Slf4j
public class RetrievalCorrectionApplier {

  /** Outcome of applying retrieved matches. */
  public record Applied(String text, List<CorrectionMatch> appliedMatches, List<String> changes) {}

  private record Edit(
      int start, int end, String original, String replacement, CorrectionMatch match) {}

  public Applied apply(String text, List<CorrectionMatch> matches) {
    List<Edit> edits = new ArrayList<>();
    for (CorrectionMatch match : matches) {
      locate(text, match).ifPresent(edits::add);
    }
    // rightmost first; for the same start the more confident match wins
    edits.sort(
        Comparator.comparingInt(Edit::start)
            .reversed()
            .thenComparing(
                Comparator.comparingDouble((Edit e) -> e.match().confidence()).reversed()));

    StringBuilder sb = new StringBuilder(text);
    List<CorrectionMatch> applied = new ArrayList<>();
    List<String> changes = new ArrayList<>();
    int boundary = Integer.MAX_VALUE;
    for (Edit edit : edits) {
      if (edit.end() > boundary) {
        log.debug("Skipping overlapping replacement '{}' at {}", edit.original(), edit.start());
        continue;
      }
      double confidence = edit.match().confidence();
      sb.replace(edit.start(), edit.end(), ChangeMarkers.wrap(edit.replacement(), confidence));
      boundary = edit.start();

      String change = CorrectionRule.describe(edit.original(), edit.replacement());
      changes.add(change);
      applied.add(edit.match().withChanges(List.of(change)));
    }
    return new Applied(sb.toString(), applied, changes);
  }

  private Optional<Edit> locate(String text, CorrectionMatch match) {
    StyleGuideEntry entry = match.entry();
    String trigger = entry.triggerText();
    if (trigger == null || trigger.isBlank()) {
      return Optional.empty();
    }
    int start = indexOfWholeWordIgnoreCase(text, trigger);
    if (start < 0) {
      return Optional.empty();
    }
    int end = start + trigger.length();
    String original = text.substring(start, end);
    Optional<String> replacement = entry.replacementFor(original);
    // deletions are reported by the rule index but never applied automatically
    if (replacement.isEmpty()
        || replacement.get().isEmpty()
        || replacement.get().equals(original)) {
      return Optional.empty();
    }
    return Optional.of(new Edit(start, end, original, replacement.get(), match));
  }

  static int indexOfWholeWordIgnoreCase(String text, String needle) {
    int last = text.length() - needle.length();
    for (int i = 0; i <= last; i++) {
      if (text.regionMatches(true, i, needle, 0, needle.length())
          && isBoundary(text, i - 1, needle.charAt(0))
          && isBoundary(text, i + needle.length(), needle.charAt(needle.length() - 1))) {
        return i;
      }
    }
    return -1;
  }

  /** A word character next to a word character at the edge of the needle is not a boundary. */
  private static boolean isBoundary(String text, int index, char edge) {
    if (index < 0 || index >= text.length() || !Character.isLetterOrDigit(edge)) {
      return true;
    }
    return !Character.isLetterOrDigit(text.charAt(index));
  }
}

package com.flamingo.ai.stylecheck.service.pipeline;

import com.flamingo.ai.stylecheck.domain.model.CorrectionResult;
import com.flamingo.ai.stylecheck.service.correction.CorrectionEngine;
import com.flamingo.ai.stylecheck.service.index.StyleGuideSession;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/** Corrects a single chunk on the correction executor. */
@Component
@RequiredArgsConstructor
public class ChunkCorrectionWorker {

  private final CorrectionEngine correctionEngine;

  @Async("correctionExecutor")
  public CompletableFuture<CorrectionResult> correctAsync(String chunk, StyleGuideSession session) {
    return CompletableFuture.completedFuture(correctionEngine.correct(chunk, session));
  }
}

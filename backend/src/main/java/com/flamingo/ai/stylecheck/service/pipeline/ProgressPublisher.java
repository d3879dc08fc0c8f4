package com.flamingo.ai.stylecheck.service.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Best-effort progress channel. Events go to every current subscriber; they are dropped when
 * nobody is subscribed or a subscriber cannot keep up. Publishing never blocks the pipeline.
 */
@Component
@Slf4j
public class ProgressPublisher {

  private final Sinks.Many<ProgressEvent> sink = Sinks.many().multicast().directBestEffort();

  /** Stream of events published after subscription. */
  public Flux<ProgressEvent> events() {
    return sink.asFlux();
  }

  // Sinks reject concurrent emission, and chunks may be corrected on several threads
  public synchronized void publish(ProgressEvent event) {
    Sinks.EmitResult result = sink.tryEmitNext(event);
    if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
      log.debug("Progress event dropped ({}): {}", result, event.message());
    }
  }

  public void publish(String stage, String phase, int current, int total, String message) {
    publish(new ProgressEvent(stage, phase, current, total, message));
  }
}

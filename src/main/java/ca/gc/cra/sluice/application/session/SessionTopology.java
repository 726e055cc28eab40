package ca.gc.cra.sluice.application.session;

import ca.gc.cra.sluice.application.port.ChunkSink;
import ca.gc.cra.sluice.application.port.ChunkSource;
import ca.gc.cra.sluice.application.port.ChunkStage;
import ca.gc.cra.sluice.application.port.SessionScheduler;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Components and scheduler owned by one session: {@code source -> stages... -> sink}.
 *
 * @param source head of the chain
 * @param stages intermediate stages in order; may be empty
 * @param sink terminal sink
 * @param scheduler session scheduler all components were built with
 * @param ledger buffered-byte tally all components report into
 * @since 0.1.0
 */
public record SessionTopology(
    ChunkSource source,
    List<ChunkStage> stages,
    ChunkSink sink,
    SessionScheduler scheduler,
    BufferLedger ledger) {

  public SessionTopology {
    Objects.requireNonNull(source, "source");
    stages = List.copyOf(stages);
    Objects.requireNonNull(sink, "sink");
    Objects.requireNonNull(scheduler, "scheduler");
    Objects.requireNonNull(ledger, "ledger");
  }

  /**
   * Sinks of the chain in order: every stage, then the terminal sink.
   *
   * @return downstream-facing components
   */
  public List<ChunkSink> sinks() {
    List<ChunkSink> sinks = new ArrayList<>(stages);
    sinks.add(sink);
    return sinks;
  }

  /**
   * Peak buffered bytes keyed by component name.
   *
   * @return insertion-ordered map of buffering components
   */
  public Map<String, Long> peakBufferedByComponent() {
    Map<String, Long> peaks = new LinkedHashMap<>();
    for (ChunkSink component : sinks()) {
      peaks.put(component.name(), component.peakBufferedBytes());
    }
    return peaks;
  }
}

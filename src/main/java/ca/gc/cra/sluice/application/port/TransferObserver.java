package ca.gc.cra.sluice.application.port;

import ca.gc.cra.sluice.domain.transfer.BackpressureEvent;
import ca.gc.cra.sluice.domain.transfer.TransferErrorKind;
import ca.gc.cra.sluice.domain.transfer.TransferReport;

/**
 * <strong>What:</strong> Reporting collaborator receiving structured session events.
 * <p><strong>Why:</strong> Keeps the core free of any output format; console, log and metrics renderers are
 * injected per session.</p>
 * <p><strong>Role:</strong> Port implemented by {@code LoggingTransferObserver} and
 * {@code MetricsTransferObserver}.</p>
 * <p><strong>Thread-safety:</strong> Called from the session scheduler thread; implementations shared
 * between sessions must be thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface TransferObserver {
  /**
   * A hop suspended its upstream because the sink saturated.
   *
   * @param event event details
   */
  default void onBackpressure(BackpressureEvent event) {}

  /**
   * The source crossed another progress mark.
   *
   * @param sessionId session identifier
   * @param bytesProduced bytes produced so far
   */
  default void onProgress(String sessionId, long bytesProduced) {}

  /**
   * The session completed successfully.
   *
   * @param report final counters
   */
  default void onSessionComplete(TransferReport report) {}

  /**
   * The session failed.
   *
   * @param sessionId session identifier
   * @param kind failure category
   * @param stage failing component name
   */
  default void onSessionError(String sessionId, TransferErrorKind kind, String stage) {}

  /** Observer that ignores every event. */
  TransferObserver NO_OP = new TransferObserver() {};
}

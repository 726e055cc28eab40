package ca.gc.cra.sluice.domain.transfer;

import java.util.Objects;

/**
 * <strong>What:</strong> Single consolidated failure surfaced by a transfer session.
 * <p><strong>Why:</strong> Callers need to know which stage failed and why without inspecting component
 * internals.</p>
 * <p><strong>Role:</strong> Checked exception travelling through listener callbacks and thrown by the
 * bridges' {@code run()} methods.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class TransferException extends Exception {
  private static final long serialVersionUID = 1L;

  private final TransferErrorKind kind;
  private final String stage;

  /**
   * Creates an exception.
   *
   * @param kind failure category; must not be {@code null}
   * @param stage name of the component that failed; must not be {@code null}
   * @param message human-readable detail
   * @param cause underlying failure; may be {@code null}
   */
  public TransferException(TransferErrorKind kind, String stage, String message, Throwable cause) {
    super(stage + ": " + message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.stage = Objects.requireNonNull(stage, "stage");
  }

  public static TransferException sourceRead(String stage, Throwable cause) {
    return new TransferException(TransferErrorKind.SOURCE_READ, stage, "read failed", cause);
  }

  public static TransferException sinkWrite(String stage, Throwable cause) {
    return new TransferException(TransferErrorKind.SINK_WRITE, stage, "write failed", cause);
  }

  public static TransferException stageCancelled(String stage, Throwable cause) {
    return new TransferException(TransferErrorKind.STAGE, stage, "cancelled mid-delay", cause);
  }

  public static TransferException aborted(String stage, String reason) {
    return new TransferException(TransferErrorKind.PIPELINE_ABORT, stage, reason, null);
  }

  public static TransferException protocolViolation(String stage, String detail) {
    return new TransferException(TransferErrorKind.PROTOCOL_VIOLATION, stage, detail, null);
  }

  /** Failure category. */
  public TransferErrorKind kind() {
    return kind;
  }

  /** Name of the component that failed. */
  public String stage() {
    return stage;
  }
}

package ca.gc.cra.sluice.domain.transfer;

/**
 * Categories of terminal transfer failures.
 *
 * @since 0.1.0
 */
public enum TransferErrorKind {
  /** The source's underlying resource could not be read. */
  SOURCE_READ,
  /** The sink's underlying resource could not be written or closed. */
  SINK_WRITE,
  /** A latency stage was cancelled while a chunk was inside its delay. */
  STAGE,
  /** The caller cancelled the session. */
  PIPELINE_ABORT,
  /** Two components broke the accept/drained contract between them. */
  PROTOCOL_VIOLATION
}

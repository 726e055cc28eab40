package ca.gc.cra.sluice.infrastructure.report;

import ca.gc.cra.sluice.application.port.TransferObserver;
import ca.gc.cra.sluice.domain.transfer.BackpressureEvent;
import ca.gc.cra.sluice.domain.transfer.TransferErrorKind;
import ca.gc.cra.sluice.domain.transfer.TransferReport;
import java.util.List;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans every event out to several observers in order.
 * <p>A failing observer is logged and skipped; reporting never fails a transfer.</p>
 *
 * @since 0.1.0
 */
public final class CompositeTransferObserver implements TransferObserver {
  private static final Logger log = LoggerFactory.getLogger(CompositeTransferObserver.class);

  private final List<TransferObserver> delegates;

  public CompositeTransferObserver(List<TransferObserver> delegates) {
    this.delegates = List.copyOf(delegates);
  }

  public static TransferObserver of(TransferObserver... delegates) {
    return new CompositeTransferObserver(List.of(delegates));
  }

  @Override
  public void onBackpressure(BackpressureEvent event) {
    forEach(observer -> observer.onBackpressure(event));
  }

  @Override
  public void onProgress(String sessionId, long bytesProduced) {
    forEach(observer -> observer.onProgress(sessionId, bytesProduced));
  }

  @Override
  public void onSessionComplete(TransferReport report) {
    forEach(observer -> observer.onSessionComplete(report));
  }

  @Override
  public void onSessionError(String sessionId, TransferErrorKind kind, String stage) {
    forEach(observer -> observer.onSessionError(sessionId, kind, stage));
  }

  private void forEach(Consumer<TransferObserver> call) {
    for (TransferObserver observer : delegates) {
      try {
        call.accept(observer);
      } catch (RuntimeException ex) {
        log.warn("Transfer observer {} failed", observer.getClass().getSimpleName(), ex);
      }
    }
  }
}

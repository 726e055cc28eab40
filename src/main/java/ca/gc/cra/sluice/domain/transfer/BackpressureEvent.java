package ca.gc.cra.sluice.domain.transfer;

/**
 * A bridge observed a saturated sink and suspended its upstream.
 *
 * @param sessionId session in which the event occurred
 * @param hop name of the hop ({@code upstream->downstream}) that saturated
 * @param count session-wide event number, starting at one
 * @param offset stream offset just past the chunk whose write saturated the sink
 * @since 0.1.0
 */
public record BackpressureEvent(String sessionId, String hop, long count, long offset) {}

/**
 * Ports of the transfer core.
 * <p>{@link ca.gc.cra.sluice.application.port.ChunkEmitter} and
 * {@link ca.gc.cra.sluice.application.port.ChunkSink} form the capability contract both bridge strategies
 * are written against; the remaining ports describe external collaborators (resources, scheduling,
 * reporting and metrics).</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sluice.application.port;

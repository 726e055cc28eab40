/**
 * Concrete transfer components: the resource-backed source and sink and the latency stage.
 * <p>All components are confined to their session's scheduler thread and never reference each other;
 * bridges in {@code application.flow} and {@code application.pipeline} connect them.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sluice.application.stage;

/**
 * Value types and failure categories shared by every transfer component.
 * <p>Nothing here performs I/O or holds mutable state.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.sluice.domain.transfer;

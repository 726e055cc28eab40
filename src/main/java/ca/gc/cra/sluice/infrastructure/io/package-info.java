/**
 * File-backed resource adapters and the sample file generator.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sluice.infrastructure.io;

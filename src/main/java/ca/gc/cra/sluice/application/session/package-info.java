/**
 * Per-session bookkeeping shared by the manual and automatic bridges.
 *
 * @since 0.1.0
 */
package ca.gc.cra.sluice.application.session;

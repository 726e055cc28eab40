/**
 * Hop bridging shared by every mode, and manual mode: one
 * {@link ca.gc.cra.sluice.application.flow.FlowController} per hop, wired by the caller.
 */
package ca.gc.cra.sluice.application.flow;

/**
 * Automatically linked modes. The orchestrator owns teardown for the whole session; the pipe use case links
 * the same way but leaves cleanup of the two ends to its caller.
 */
package ca.gc.cra.sluice.application.pipeline;

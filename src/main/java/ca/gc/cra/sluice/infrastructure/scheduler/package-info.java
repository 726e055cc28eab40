/**
 * Scheduler adapters for transfer sessions.
 */
package ca.gc.cra.sluice.infrastructure.scheduler;

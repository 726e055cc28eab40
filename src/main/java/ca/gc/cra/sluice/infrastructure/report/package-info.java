/**
 * Reporting collaborators for transfer sessions: log rendering, metrics bridging and memory snapshots.
 */
package ca.gc.cra.sluice.infrastructure.report;

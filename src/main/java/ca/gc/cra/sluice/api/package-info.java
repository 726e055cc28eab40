/**
 * Command-line entry points: the {@code sluice} dispatcher and its {@code transfer} and {@code generate}
 * commands.
 * <p>Commands parse {@code key=value} arguments, merge them with YAML and defaults, and map outcomes to
 * {@link ca.gc.cra.sluice.api.ExitCode}s.</p>
 */
package ca.gc.cra.sluice.api;

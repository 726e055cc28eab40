/**
 * Configuration records, layered loading (defaults, YAML, CLI) and the composition root for sluice commands.
 * <p>Configuration objects are immutable; validation failures surface as {@link IllegalArgumentException}.</p>
 */
package ca.gc.cra.sluice.config;

/**
 * Configuration records and composition root wiring for the terf CLIs.
 * <p><strong>Role:</strong> Merges defaults, the YAML file and {@code key=value} arguments into
 * immutable, validated records and builds use cases from them.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> YAML is parsed with SnakeYAML's safe constructor; paths are checked
 * with {@code ca.gc.cra.terf.validation} utilities.</p>
 */
package ca.gc.cra.terf.config;

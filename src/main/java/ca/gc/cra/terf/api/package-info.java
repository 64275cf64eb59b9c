/**
 * Command-line entry points: the {@code terf} dispatcher and the build, extract and summary commands.
 * <p><strong>Role:</strong> Parse {@code key=value} arguments and flags, layer them over YAML and
 * defaults, validate paths, run one use case and map its outcome to an {@link ca.gc.cra.terf.api.ExitCode}.</p>
 * <p><strong>Output:</strong> usage text, dry-run plans and reports go to stdout through
 * {@link ca.gc.cra.terf.api.CliPrinter}; logs go to stderr.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.terf.api;

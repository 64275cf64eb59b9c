/**
 * <strong>Purpose:</strong> Validation helpers used during CLI parsing and configuration bootstrap.
 * <p>Inputs are rejected before any worker thread starts or any output file is created; failures
 * surface as {@link IllegalArgumentException} and map to exit code 2 in the CLI.</p>
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.terf.validation;

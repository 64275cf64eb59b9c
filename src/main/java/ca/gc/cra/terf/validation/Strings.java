package ca.gc.cra.terf.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation helpers for CLI and configuration values.
 * <p><strong>Role:</strong> Guards shard base names, which end up in file names, and other
 * free-form knobs before they reach the filesystem.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern SHARD_NAME_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");

  private Strings() {
    // Utility
  }

  /**
   * Trims {@code value} and rejects blanks and control characters.
   *
   * @param name parameter name used in error messages
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if blank or containing control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a dataset base name used as the prefix of shard file names.
   *
   * @param name parameter name used in error messages
   * @param value candidate base name, e.g. {@code train}
   * @return trimmed base name
   * @throws IllegalArgumentException if the name contains anything but letters, digits, dot,
   *     underscore or hyphen, or is {@code .} / {@code ..}
   */
  public static String sanitizeShardName(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!SHARD_NAME_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    if (sanitized.equals(".") || sanitized.equals("..")) {
      throw new IllegalArgumentException(message(name, "must not be a relative directory name"));
    }
    return sanitized;
  }

  /**
   * Requires a non-blank, printable ASCII value of bounded length.
   *
   * @param name parameter name used in error messages
   * @param value candidate value
   * @param maxLength maximum accepted length
   * @return trimmed value
   * @throws IllegalArgumentException if blank, too long, or containing non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}

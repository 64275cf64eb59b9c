package ca.gc.cra.terf.domain.image;

/**
 * Colorspace labels written to the {@code image/colorspace} feature.
 *
 * @since 0.1.0
 */
public enum Colorspace {
  RGB("RGB"),
  CMYK("CMYK"),
  GRAY("Gray"),
  UNKNOWN("Unknown");

  private final String label;

  Colorspace(String label) {
    this.label = label;
  }

  /**
   * Label as stored in records.
   *
   * @return stored label, e.g. {@code Gray}
   */
  public String label() {
    return label;
  }
}

package io.protoargs.parser.api;

/**
 * Tuning knobs for {@link ArgsParser}.
 *
 * <p>Defaults can be changed JVM-wide with the system properties {@value #MAX_NESTING_DEPTH_PROP}
 * and {@value #DECODE_PACKED_PROP}.
 */
public final class ArgsParserOptions {
  public static final String MAX_NESTING_DEPTH_PROP = "io.protoargs.parser.max_nesting_depth";
  public static final String DECODE_PACKED_PROP = "io.protoargs.parser.decode_packed";

  static final int DEFAULT_MAX_NESTING_DEPTH = 100;

  private final int maxNestingDepth;
  private final boolean decodePackedFields;

  private ArgsParserOptions(Builder builder) {
    this.maxNestingDepth = builder.maxNestingDepth;
    this.decodePackedFields = builder.decodePackedFields;
  }

  /**
   * Options derived from the system properties, falling back to the built-in defaults.
   *
   * @return the default options
   */
  public static ArgsParserOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Maximum number of nested message frames, counting the top-level message as 1.
   *
   * @return the nesting limit
   */
  public int maxNestingDepth() {
    return maxNestingDepth;
  }

  /**
   * Whether packed repeated scalars are expanded into individual occurrences.
   *
   * @return {@code true} if packed fields are decoded
   */
  public boolean decodePackedFields() {
    return decodePackedFields;
  }

  @Override
  public String toString() {
    return "ArgsParserOptions{maxNestingDepth="
        + maxNestingDepth
        + ", decodePackedFields="
        + decodePackedFields
        + "}";
  }

  /** Builder for {@link ArgsParserOptions}. */
  public static final class Builder {
    private int maxNestingDepth =
        Integer.getInteger(MAX_NESTING_DEPTH_PROP, DEFAULT_MAX_NESTING_DEPTH);
    private boolean decodePackedFields =
        Boolean.parseBoolean(System.getProperty(DECODE_PACKED_PROP, "true"));

    private Builder() {}

    public Builder maxNestingDepth(int maxNestingDepth) {
      this.maxNestingDepth = maxNestingDepth;
      return this;
    }

    public Builder decodePackedFields(boolean decodePackedFields) {
      this.decodePackedFields = decodePackedFields;
      return this;
    }

    /**
     * Builds the options.
     *
     * @return the options
     * @throws IllegalArgumentException if the nesting depth is not positive
     */
    public ArgsParserOptions build() {
      if (maxNestingDepth < 1) {
        throw new IllegalArgumentException(
            "maxNestingDepth must be at least 1, was " + maxNestingDepth);
      }
      return new ArgsParserOptions(this);
    }
  }
}

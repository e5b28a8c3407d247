package io.protoargs.parser.api;

/** Thrown when nested messages exceed {@link ArgsParserOptions#maxNestingDepth()}. */
public class NestingTooDeepException extends ArgsParseException {

  /**
   * Constructs a new NestingTooDeepException.
   *
   * @param maxDepth the configured limit
   * @param path the key path at which the limit was hit
   */
  public NestingTooDeepException(int maxDepth, String path) {
    super("Message nesting exceeds " + maxDepth + " levels", path, NESTING_TOO_DEEP);
  }
}

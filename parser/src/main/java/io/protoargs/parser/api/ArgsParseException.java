package io.protoargs.parser.api;

/**
 * Base exception for all argument parsing errors.
 *
 * <p>The parser never recovers from one of these: the first exception ends the parse, and the
 * arguments emitted before it stay with the delegate. Subclasses set an error code, one per failure
 * class, so callers can branch without {@code instanceof} chains:
 *
 * <ul>
 *   <li>{@link #SCHEMA_NOT_FOUND}: {@link SchemaNotFoundException}, context is the type name
 *   <li>{@link #UNSUPPORTED_FIELD_TYPE}: {@link UnsupportedFieldTypeException}, context is {@code
 *       <message type>.<field>}
 *   <li>{@link #WIRE_FORMAT}: {@link WireFormatException}, context is the offset or tag
 *   <li>{@link #NESTING_TOO_DEEP}: {@link NestingTooDeepException}, context is the current key
 * </ul>
 *
 * <p>Exceptions raised by a {@link ParsingOverride} may carry any code, or none.
 */
public class ArgsParseException extends Exception {
  public static final String SCHEMA_NOT_FOUND = "SCHEMA_NOT_FOUND";
  public static final String UNSUPPORTED_FIELD_TYPE = "UNSUPPORTED_FIELD_TYPE";
  public static final String WIRE_FORMAT = "WIRE_FORMAT";
  public static final String NESTING_TOO_DEEP = "NESTING_TOO_DEEP";

  private final String context;
  private final String errorCode;

  public ArgsParseException(String message) {
    this(message, null, null);
  }

  public ArgsParseException(String message, Throwable cause) {
    this(message, cause, null, null);
  }

  public ArgsParseException(String message, String context, String errorCode) {
    this(message, null, context, errorCode);
  }

  public ArgsParseException(String message, Throwable cause, String context, String errorCode) {
    super(formatMessage(message, context, errorCode), cause);
    this.context = context;
    this.errorCode = errorCode;
  }

  private static String formatMessage(String message, String context, String errorCode) {
    StringBuilder sb = new StringBuilder(message);
    if (context != null) {
      sb.append(" [Context: ").append(context).append("]");
    }
    if (errorCode != null) {
      sb.append(" [Error Code: ").append(errorCode).append("]");
    }
    return sb.toString();
  }

  public String getContext() {
    return context;
  }

  /**
   * Gets the error code.
   *
   * @return one of the codes declared on this class, or whatever an override supplied; may be
   *     {@code null}
   */
  public String getErrorCode() {
    return errorCode;
  }
}

package io.protoargs.parser.api;

/** Exception thrown when the binary payload is not a well-formed protobuf wire stream. */
public class WireFormatException extends ArgsParseException {

  /**
   * Constructs a new WireFormatException with the specified message.
   *
   * @param message the detail message
   */
  public WireFormatException(String message) {
    super(message, null, WIRE_FORMAT);
  }

  /**
   * Constructs a new WireFormatException with the specified message and context.
   *
   * @param message the detail message
   * @param context the context information
   */
  public WireFormatException(String message, String context) {
    super(message, context, WIRE_FORMAT);
  }

  /**
   * Creates a WireFormatException for a payload that ends in the middle of a value.
   *
   * @param what the kind of value being read
   * @param offset the offset of the value within the decoded span
   * @return a new WireFormatException instance
   */
  public static WireFormatException truncated(String what, int offset) {
    return new WireFormatException("Truncated " + what, "offset " + offset);
  }

  /**
   * Creates a WireFormatException for reading a field with an accessor its wire type does not
   * support.
   *
   * @param tag the field tag
   * @param wireType the actual wire type
   * @param accessor the accessor that was requested
   * @return a new WireFormatException instance
   */
  public static WireFormatException accessorMismatch(int tag, Object wireType, String accessor) {
    return new WireFormatException(
        "Cannot read " + wireType + " field as " + accessor, "tag " + tag);
  }
}

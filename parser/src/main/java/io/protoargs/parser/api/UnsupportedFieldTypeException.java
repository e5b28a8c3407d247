package io.protoargs.parser.api;

/**
 * Thrown when a field is declared with a type that has no argument representation, e.g. a
 * proto2 group.
 */
public class UnsupportedFieldTypeException extends ArgsParseException {
  private final String fieldName;
  private final String messageType;
  private final int typeTag;

  /**
   * Constructs a new UnsupportedFieldTypeException.
   *
   * @param fieldName the name of the offending field
   * @param messageType the full name of the message declaring the field
   * @param typeTag the raw declared type, as numbered by {@code FieldDescriptorProto.Type}
   */
  public UnsupportedFieldTypeException(String fieldName, String messageType, int typeTag) {
    super(
        "Tried to write value of field "
            + fieldName
            + " (in proto type "
            + messageType
            + ") which has declared type "
            + typeTag,
        messageType + "." + fieldName,
        UNSUPPORTED_FIELD_TYPE);
    this.fieldName = fieldName;
    this.messageType = messageType;
    this.typeTag = typeTag;
  }

  public String getFieldName() {
    return fieldName;
  }

  public String getMessageType() {
    return messageType;
  }

  public int getTypeTag() {
    return typeTag;
  }
}

package io.protoargs.parser.internal_api.metadata;

import java.util.Objects;

/**
 * Immutable description of one message field.
 *
 * <p>The declared type is kept as the raw descriptor number so that descriptors using a type this
 * library does not know can still be loaded; {@link #type()} is {@code null} for those.
 */
public final class FieldDescriptor {
  private final String name;
  private final int number;
  private final int typeTag;
  private final String resolvedTypeName;
  private final boolean repeated;
  private final boolean extension;

  /**
   * Constructs a new FieldDescriptor.
   *
   * @param name the field name
   * @param number the field number (tag)
   * @param typeTag the declared type, numbered as in {@link FieldType}
   * @param resolvedTypeName full name of the message or enum type, {@code null} for scalars
   * @param repeated whether the field is repeated
   * @param extension whether the field is declared in an {@code extend} block
   */
  public FieldDescriptor(
      String name,
      int number,
      int typeTag,
      String resolvedTypeName,
      boolean repeated,
      boolean extension) {
    this.name = Objects.requireNonNull(name, "name");
    this.number = number;
    this.typeTag = typeTag;
    this.resolvedTypeName = DescriptorPool.normalizeName(resolvedTypeName);
    this.repeated = repeated;
    this.extension = extension;
  }

  public static FieldDescriptor scalar(String name, int number, FieldType type) {
    return new FieldDescriptor(name, number, type.id(), null, false, false);
  }

  public static FieldDescriptor message(String name, int number, String messageType) {
    return new FieldDescriptor(name, number, FieldType.MESSAGE.id(), messageType, false, false);
  }

  public static FieldDescriptor enumField(String name, int number, String enumType) {
    return new FieldDescriptor(name, number, FieldType.ENUM.id(), enumType, false, false);
  }

  /**
   * Copy of this descriptor marked as repeated.
   *
   * @return the repeated descriptor
   */
  public FieldDescriptor repeated() {
    return new FieldDescriptor(name, number, typeTag, resolvedTypeName, true, extension);
  }

  /**
   * Copy of this descriptor marked as an extension.
   *
   * @return the extension descriptor
   */
  public FieldDescriptor asExtension() {
    return new FieldDescriptor(name, number, typeTag, resolvedTypeName, repeated, true);
  }

  public String name() {
    return name;
  }

  public int number() {
    return number;
  }

  public int typeTag() {
    return typeTag;
  }

  /**
   * Gets the declared type.
   *
   * @return the type, or {@code null} if {@link #typeTag()} is not a known type
   */
  public FieldType type() {
    return FieldType.fromId(typeTag);
  }

  /**
   * Gets the full name of the message or enum type of this field, without a leading dot.
   *
   * @return the type name, or {@code null} for scalar fields
   */
  public String resolvedTypeName() {
    return resolvedTypeName;
  }

  public boolean isRepeated() {
    return repeated;
  }

  public boolean isExtension() {
    return extension;
  }

  @Override
  public String toString() {
    FieldType type = type();
    return (repeated ? "repeated " : "")
        + (resolvedTypeName != null ? resolvedTypeName : type != null ? type : "type#" + typeTag)
        + " "
        + name
        + " = "
        + number
        + (extension ? " (extension)" : "");
  }
}

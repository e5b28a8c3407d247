package io.protoargs.parser.internal_api.metadata;

import io.protoargs.parser.internal_api.WireType;

/** Declared field types, numbered as in {@code google.protobuf.FieldDescriptorProto.Type}. */
public enum FieldType {
  DOUBLE(1, WireType.FIXED64),
  FLOAT(2, WireType.FIXED32),
  INT64(3, WireType.VARINT),
  UINT64(4, WireType.VARINT),
  INT32(5, WireType.VARINT),
  FIXED64(6, WireType.FIXED64),
  FIXED32(7, WireType.FIXED32),
  BOOL(8, WireType.VARINT),
  STRING(9, null),
  GROUP(10, null),
  MESSAGE(11, null),
  BYTES(12, null),
  UINT32(13, WireType.VARINT),
  ENUM(14, WireType.VARINT),
  SFIXED32(15, WireType.FIXED32),
  SFIXED64(16, WireType.FIXED64),
  SINT32(17, WireType.VARINT),
  SINT64(18, WireType.VARINT);

  private static final FieldType[] BY_ID = new FieldType[19];

  static {
    for (FieldType t : values()) {
      BY_ID[t.id] = t;
    }
  }

  private final int id;
  private final WireType packedWireType;

  FieldType(int id, WireType packedWireType) {
    this.id = id;
    this.packedWireType = packedWireType;
  }

  public int id() {
    return id;
  }

  /**
   * Gets the wire type of one element when a repeated field of this type is packed.
   *
   * @return the element wire type, or {@code null} if this type cannot be packed
   */
  public WireType packedWireType() {
    return packedWireType;
  }

  public boolean isPackable() {
    return packedWireType != null;
  }

  /**
   * Resolves a field type from its descriptor id.
   *
   * @param id the numeric type
   * @return the field type, or {@code null} if the id is not a known type
   */
  public static FieldType fromId(int id) {
    return id > 0 && id < BY_ID.length ? BY_ID[id] : null;
  }
}

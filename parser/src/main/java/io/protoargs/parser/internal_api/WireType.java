package io.protoargs.parser.internal_api;

/** Protobuf wire types, as stored in the low three bits of a field key. */
public enum WireType {
  VARINT(0),
  FIXED64(1),
  LENGTH_DELIMITED(2),
  START_GROUP(3),
  END_GROUP(4),
  FIXED32(5);

  private static final WireType[] BY_ID = new WireType[8];

  static {
    for (WireType t : values()) {
      BY_ID[t.id] = t;
    }
  }

  private final int id;

  WireType(int id) {
    this.id = id;
  }

  public int id() {
    return id;
  }

  /**
   * Resolves a wire type from its numeric id.
   *
   * @param id the id, 0..7
   * @return the wire type or {@code null} for the unassigned ids 6 and 7
   */
  public static WireType fromId(int id) {
    return id >= 0 && id < BY_ID.length ? BY_ID[id] : null;
  }
}

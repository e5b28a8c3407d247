package io.protoargs.parser.internal_api;

import io.protoargs.parser.api.WireFormatException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * One decoded {@code (tag, value)} unit of a protobuf message.
 *
 * <p>Numeric wire types keep their raw 64 bits; the typed accessors reinterpret them according to
 * the declared schema type chosen by the caller. Length-delimited fields keep a read-only view of
 * the payload, valid as long as the decoded buffer is.
 */
public final class WireField {
  private final int tag;
  private final WireType wireType;
  private final long value;
  private final ByteBuffer payload;

  private WireField(int tag, WireType wireType, long value, ByteBuffer payload) {
    this.tag = tag;
    this.wireType = wireType;
    this.value = value;
    this.payload = payload;
  }

  /**
   * Creates a numeric field.
   *
   * @param tag the field number
   * @param wireType {@link WireType#VARINT}, {@link WireType#FIXED32} or {@link WireType#FIXED64}
   * @param value the raw bits
   * @return the field
   */
  public static WireField numeric(int tag, WireType wireType, long value) {
    if (wireType == WireType.LENGTH_DELIMITED) {
      throw new IllegalArgumentException("Not a numeric wire type: " + wireType);
    }
    return new WireField(tag, wireType, value, null);
  }

  /**
   * Creates a length-delimited field.
   *
   * @param tag the field number
   * @param payload the payload, from position to limit
   * @return the field
   */
  public static WireField lengthDelimited(int tag, ByteBuffer payload) {
    return new WireField(tag, WireType.LENGTH_DELIMITED, 0, payload.asReadOnlyBuffer());
  }

  public int tag() {
    return tag;
  }

  public WireType wireType() {
    return wireType;
  }

  public int asInt32() throws WireFormatException {
    return (int) numeric("int32");
  }

  public long asInt64() throws WireFormatException {
    return numeric("int64");
  }

  /**
   * Reads the value as {@code uint32}.
   *
   * @return the value in the range {@code [0, 2^32)}
   * @throws WireFormatException if the field is length-delimited
   */
  public long asUint32() throws WireFormatException {
    return numeric("uint32") & 0xFFFFFFFFL;
  }

  /**
   * Reads the value as {@code uint64}. Values above {@link Long#MAX_VALUE} come back negative and
   * must be treated as unsigned.
   *
   * @return the raw 64 bits
   * @throws WireFormatException if the field is length-delimited
   */
  public long asUint64() throws WireFormatException {
    return numeric("uint64");
  }

  public int asSint32() throws WireFormatException {
    int n = (int) numeric("sint32");
    return (n >>> 1) ^ -(n & 1);
  }

  public long asSint64() throws WireFormatException {
    long n = numeric("sint64");
    return (n >>> 1) ^ -(n & 1);
  }

  public boolean asBool() throws WireFormatException {
    return numeric("bool") != 0;
  }

  public double asDouble() throws WireFormatException {
    return Double.longBitsToDouble(numeric("double"));
  }

  public float asFloat() throws WireFormatException {
    return Float.intBitsToFloat((int) numeric("float"));
  }

  /**
   * Decodes the payload as UTF-8. Malformed sequences are replaced, not reported.
   *
   * @return the string
   * @throws WireFormatException if the field is not length-delimited
   */
  public String asString() throws WireFormatException {
    return StandardCharsets.UTF_8.decode(asBytes()).toString();
  }

  /**
   * Gets the payload.
   *
   * @return a fresh read-only view of the payload
   * @throws WireFormatException if the field is not length-delimited
   */
  public ByteBuffer asBytes() throws WireFormatException {
    if (payload == null) {
      throw WireFormatException.accessorMismatch(tag, wireType, "bytes");
    }
    return payload.duplicate();
  }

  private long numeric(String accessor) throws WireFormatException {
    if (payload != null) {
      throw WireFormatException.accessorMismatch(tag, wireType, accessor);
    }
    return value;
  }

  @Override
  public String toString() {
    return "WireField{tag="
        + tag
        + ", "
        + wireType
        + (payload != null ? ", " + payload.remaining() + " bytes" : ", value=" + value)
        + "}";
  }
}

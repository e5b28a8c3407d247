package io.protoargs.parser.internal_api;

import io.protoargs.parser.api.WireFormatException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Single-pass reader of protobuf wire fields.
 *
 * <p>The decoder works on its own view of the given span, so the caller's buffer position and
 * limit are left untouched. Length-delimited payloads are returned as views, not copies.
 */
public final class ProtoDecoder {
  private static final int MAX_VARINT_BYTES = 10;
  private static final int MAX_FIELD_NUMBER = (1 << 29) - 1;

  private final ByteBuffer buffer;

  /**
   * Creates a decoder over {@code span}, from its position to its limit.
   *
   * @param span the encoded message
   */
  public ProtoDecoder(ByteBuffer span) {
    this.buffer = span.slice().order(ByteOrder.LITTLE_ENDIAN);
  }

  /**
   * Checks whether there are more bytes to decode.
   *
   * @return {@code true} if {@link #readField()} will return a field or fail
   */
  public boolean hasRemaining() {
    return buffer.hasRemaining();
  }

  /**
   * Reads the next field.
   *
   * @return the next field, or {@code null} once the span is exhausted
   * @throws WireFormatException if the next field is malformed or truncated
   */
  public WireField readField() throws WireFormatException {
    if (!buffer.hasRemaining()) {
      return null;
    }
    int start = buffer.position();
    long fieldKey = readVarint();
    long number = fieldKey >>> 3;
    if (number == 0 || number > MAX_FIELD_NUMBER) {
      throw new WireFormatException("Invalid field number " + number, "offset " + start);
    }
    int tag = (int) number;
    WireType wireType = WireType.fromId((int) (fieldKey & 0x7));
    if (wireType == null) {
      throw new WireFormatException(
          "Invalid wire type " + (fieldKey & 0x7), "tag " + tag + " at offset " + start);
    }
    switch (wireType) {
      case VARINT:
        return WireField.numeric(tag, wireType, readVarint());
      case FIXED64:
        return WireField.numeric(tag, wireType, readFixed64());
      case FIXED32:
        return WireField.numeric(tag, wireType, readFixed32());
      case LENGTH_DELIMITED:
        return WireField.lengthDelimited(tag, readPayload());
      default:
        throw new WireFormatException(
            "Groups are not supported", "tag " + tag + " at offset " + start);
    }
  }

  /**
   * Expands a packed repeated field into one field per element.
   *
   * @param packed a length-delimited field holding the packed elements
   * @param elementType the wire type of a single element
   * @return the elements in wire order, all carrying the tag of {@code packed}
   * @throws WireFormatException if the payload does not split into whole elements
   */
  public static List<WireField> readPacked(WireField packed, WireType elementType)
      throws WireFormatException {
    ProtoDecoder decoder = new ProtoDecoder(packed.asBytes());
    List<WireField> elements = new ArrayList<>();
    while (decoder.hasRemaining()) {
      long value;
      switch (elementType) {
        case VARINT:
          value = decoder.readVarint();
          break;
        case FIXED32:
          value = decoder.readFixed32();
          break;
        case FIXED64:
          value = decoder.readFixed64();
          break;
        default:
          throw new IllegalArgumentException("Not a packable wire type: " + elementType);
      }
      elements.add(WireField.numeric(packed.tag(), elementType, value));
    }
    return elements;
  }

  long readVarint() throws WireFormatException {
    int start = buffer.position();
    long ret = 0;
    for (int i = 0; i < MAX_VARINT_BYTES; i++) {
      if (!buffer.hasRemaining()) {
        throw WireFormatException.truncated("varint", start);
      }
      byte b = buffer.get();
      ret |= (b & 0x7FL) << (7 * i);
      if (b >= 0) {
        return ret;
      }
    }
    throw new WireFormatException("Malformed varint", "offset " + start);
  }

  private long readFixed64() throws WireFormatException {
    if (buffer.remaining() < Long.BYTES) {
      throw WireFormatException.truncated("fixed64", buffer.position());
    }
    return buffer.getLong();
  }

  private long readFixed32() throws WireFormatException {
    if (buffer.remaining() < Integer.BYTES) {
      throw WireFormatException.truncated("fixed32", buffer.position());
    }
    return buffer.getInt() & 0xFFFFFFFFL;
  }

  private ByteBuffer readPayload() throws WireFormatException {
    int start = buffer.position();
    long len = readVarint();
    if (len < 0 || len > buffer.remaining()) {
      throw WireFormatException.truncated("length-delimited field of " + len + " bytes", start);
    }
    int from = buffer.position();
    buffer.position(from + (int) len);
    return buffer.slice(from, (int) len);
  }
}

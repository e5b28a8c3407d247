package io.protoargs.parser.impl;

import io.protoargs.parser.api.ArgsParseException;
import io.protoargs.parser.api.ArgsParser;
import io.protoargs.parser.api.ArgsParserOptions;
import io.protoargs.parser.api.Delegate;
import io.protoargs.parser.api.Key;
import io.protoargs.parser.api.NestingTooDeepException;
import io.protoargs.parser.api.ParsingOverride;
import io.protoargs.parser.api.SchemaNotFoundException;
import io.protoargs.parser.api.UnsupportedFieldTypeException;
import io.protoargs.parser.internal_api.KeyPathBuilder;
import io.protoargs.parser.internal_api.OverrideRegistry;
import io.protoargs.parser.internal_api.ProtoDecoder;
import io.protoargs.parser.internal_api.WireField;
import io.protoargs.parser.internal_api.WireType;
import io.protoargs.parser.internal_api.metadata.DescriptorPool;
import io.protoargs.parser.internal_api.metadata.FieldDescriptor;
import io.protoargs.parser.internal_api.metadata.FieldType;
import io.protoargs.parser.internal_api.metadata.ProtoDescriptor;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.nio.ByteBuffer;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent implementation of {@link ArgsParser}.
 *
 * <p>The key path is extended when a field is entered and restored when it is left, on every exit
 * path including exceptions, so sibling fields never see each other's segments.
 */
public final class ArgsParserImpl implements ArgsParser {
  private static final Logger log = LoggerFactory.getLogger(ArgsParserImpl.class);

  private final DescriptorPool pool;
  private final ArgsParserOptions options;
  private final KeyPathBuilder keyPrefix = new KeyPathBuilder();
  private final OverrideRegistry overrides = new OverrideRegistry();

  private int depth;

  public ArgsParserImpl(DescriptorPool pool, ArgsParserOptions options) {
    this.pool = Objects.requireNonNull(pool, "pool");
    this.options = Objects.requireNonNull(options, "options");
  }

  @Override
  public void addParsingOverride(String flatKey, ParsingOverride override) {
    overrides.register(flatKey, override);
  }

  @Override
  public void parseMessage(ByteBuffer bytes, String typeName, IntSet allowedTags, Delegate delegate)
      throws ArgsParseException {
    ProtoDescriptor descriptor = pool.findMessage(typeName);
    if (descriptor == null) {
      throw new SchemaNotFoundException(typeName);
    }
    if (depth >= options.maxNestingDepth()) {
      throw new NestingTooDeepException(options.maxNestingDepth(), keyPrefix.key());
    }
    depth++;
    try {
      parseFields(descriptor, bytes, allowedTags, delegate);
    } finally {
      depth--;
    }
  }

  private void parseFields(
      ProtoDescriptor descriptor, ByteBuffer bytes, IntSet allowedTags, Delegate delegate)
      throws ArgsParseException {
    // occurrence counters are per message frame, never shared with parents or siblings
    Int2IntOpenHashMap repeatedFieldIndex = new Int2IntOpenHashMap();

    ProtoDecoder decoder = new ProtoDecoder(bytes);
    for (WireField f = decoder.readField(); f != null; f = decoder.readField()) {
      FieldDescriptor field = descriptor.findFieldByTag(f.tag());
      if (field == null) {
        // unknown field, possibly an extension missing from the pool
        if (log.isDebugEnabled()) {
          log.debug("Skipping unknown tag {} in {}", f.tag(), descriptor.fullName());
        }
        continue;
      }
      boolean allowed =
          field.isExtension() || allowedTags == null || allowedTags.contains(f.tag());
      if (!allowed) {
        if (log.isDebugEnabled()) {
          log.debug("Skipping tag {} of {}, not in allowlist", f.tag(), descriptor.fullName());
        }
        continue;
      }
      if (isPacked(field, f)) {
        for (WireField element : ProtoDecoder.readPacked(f, field.type().packedWireType())) {
          parseField(descriptor, field, repeatedFieldIndex.get(f.tag()), element, delegate);
          repeatedFieldIndex.addTo(f.tag(), 1);
        }
        continue;
      }
      parseField(descriptor, field, repeatedFieldIndex.get(f.tag()), f, delegate);
      if (field.isRepeated()) {
        repeatedFieldIndex.addTo(f.tag(), 1);
      }
    }
  }

  private boolean isPacked(FieldDescriptor descriptor, WireField field) {
    if (!options.decodePackedFields()
        || !descriptor.isRepeated()
        || field.wireType() != WireType.LENGTH_DELIMITED) {
      return false;
    }
    FieldType type = descriptor.type();
    return type != null && type.isPackable();
  }

  /**
   * Decodes one occurrence of a field under its own key segment.
   *
   * @param owner the message declaring (or being extended by) the field
   * @param descriptor the field descriptor
   * @param repeatedIndex the occurrence index, used only for repeated fields
   * @param field the raw field
   * @param delegate the argument sink
   * @throws ArgsParseException on the first fatal error
   */
  void parseField(
      ProtoDescriptor owner,
      FieldDescriptor descriptor,
      int repeatedIndex,
      WireField field,
      Delegate delegate)
      throws ArgsParseException {
    String name = descriptor.name();
    String keySegment = descriptor.isRepeated() ? name + "[" + repeatedIndex + "]" : name;

    try (KeyPathBuilder.Scope key = keyPrefix.pushKey(keySegment);
        KeyPathBuilder.Scope flatKey = keyPrefix.pushFlatKey(name)) {
      if (log.isTraceEnabled()) {
        log.trace("Parsing {} as {}", keyPrefix, descriptor);
      }
      if (!overrides.isEmpty()) {
        ParsingOverride override = overrides.lookup(keyPrefix.flatKey());
        if (override != null) {
          override.handle(field, delegate);
          return;
        }
      }
      if (descriptor.type() == FieldType.MESSAGE) {
        parseMessage(field.asBytes(), descriptor.resolvedTypeName(), null, delegate);
        return;
      }
      parseSimpleField(owner, descriptor, field, delegate);
    }
  }

  /**
   * Emits a scalar or enum field at the current key.
   *
   * @param owner the message declaring (or being extended by) the field
   * @param descriptor the field descriptor
   * @param field the raw field
   * @param delegate the argument sink
   * @throws UnsupportedFieldTypeException if the declared type has no argument representation
   * @throws ArgsParseException if the wire type does not match the declared type
   */
  void parseSimpleField(
      ProtoDescriptor owner, FieldDescriptor descriptor, WireField field, Delegate delegate)
      throws ArgsParseException {
    FieldType type = descriptor.type();
    if (type == null) {
      throw new UnsupportedFieldTypeException(
          descriptor.name(), owner.fullName(), descriptor.typeTag());
    }
    Key key = keyPrefix.snapshot();
    switch (type) {
      case INT32:
      case SFIXED32:
      case FIXED32:
        delegate.addInteger(key, field.asInt32());
        return;
      case SINT32:
        delegate.addInteger(key, field.asSint32());
        return;
      case INT64:
      case SFIXED64:
      case FIXED64:
        delegate.addInteger(key, field.asInt64());
        return;
      case SINT64:
        delegate.addInteger(key, field.asSint64());
        return;
      case UINT32:
        delegate.addUnsignedInteger(key, field.asUint32());
        return;
      case UINT64:
        delegate.addUnsignedInteger(key, field.asUint64());
        return;
      case BOOL:
        delegate.addBoolean(key, field.asBool());
        return;
      case DOUBLE:
        delegate.addDouble(key, field.asDouble());
        return;
      case FLOAT:
        delegate.addDouble(key, field.asFloat());
        return;
      case STRING:
      case BYTES:
        delegate.addString(key, field.asString());
        return;
      case ENUM:
        addEnum(key, descriptor, field.asInt32(), delegate);
        return;
      default:
        throw new UnsupportedFieldTypeException(
            descriptor.name(), owner.fullName(), descriptor.typeTag());
    }
  }

  private void addEnum(Key key, FieldDescriptor descriptor, int value, Delegate delegate) {
    ProtoDescriptor enumDescriptor = pool.findDescriptor(descriptor.resolvedTypeName());
    String symbol = enumDescriptor != null ? enumDescriptor.findEnumName(value) : null;
    if (symbol == null) {
      if (log.isDebugEnabled()) {
        log.debug(
            "No symbol for value {} of enum {} at {}, emitting integer",
            value,
            descriptor.resolvedTypeName(),
            key);
      }
      delegate.addInteger(key, value);
      return;
    }
    delegate.addString(key, symbol);
  }
}

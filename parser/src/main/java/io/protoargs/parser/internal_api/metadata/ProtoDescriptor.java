package io.protoargs.parser.internal_api.metadata;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Runtime description of a message or an enum type.
 *
 * <p>Messages hold their fields, including extensions attached by the {@link DescriptorPool};
 * enums hold their symbolic values. Descriptors are filled while the pool is built and must not be
 * changed once parsing starts.
 */
public final class ProtoDescriptor {
  public enum Kind {
    MESSAGE,
    ENUM
  }

  private final String fullName;
  private final Kind kind;

  private final Int2ObjectMap<FieldDescriptor> fieldsByTag = new Int2ObjectOpenHashMap<>();
  private final Map<String, FieldDescriptor> fieldsByName = new HashMap<>();
  private final Int2ObjectMap<String> enumNames = new Int2ObjectOpenHashMap<>();

  private ProtoDescriptor(String fullName, Kind kind) {
    this.fullName = DescriptorPool.normalizeName(Objects.requireNonNull(fullName, "fullName"));
    this.kind = kind;
  }

  public static ProtoDescriptor message(String fullName) {
    return new ProtoDescriptor(fullName, Kind.MESSAGE);
  }

  public static ProtoDescriptor enumType(String fullName) {
    return new ProtoDescriptor(fullName, Kind.ENUM);
  }

  /**
   * Adds a field, replacing any field with the same number.
   *
   * @param field the field
   * @return this descriptor
   * @throws IllegalStateException if this descriptor is an enum
   */
  public ProtoDescriptor addField(FieldDescriptor field) {
    if (kind != Kind.MESSAGE) {
      throw new IllegalStateException("Cannot add field " + field.name() + " to enum " + fullName);
    }
    FieldDescriptor previous = fieldsByTag.put(field.number(), field);
    if (previous != null) {
      fieldsByName.remove(previous.name());
    }
    fieldsByName.put(field.name(), field);
    return this;
  }

  /**
   * Adds an enum value. For aliased numbers the first name added is kept.
   *
   * @param number the numeric value
   * @param name the symbolic name
   * @return this descriptor
   * @throws IllegalStateException if this descriptor is a message
   */
  public ProtoDescriptor addEnumValue(int number, String name) {
    if (kind != Kind.ENUM) {
      throw new IllegalStateException("Cannot add enum value " + name + " to message " + fullName);
    }
    enumNames.putIfAbsent(number, name);
    return this;
  }

  public String fullName() {
    return fullName;
  }

  public Kind kind() {
    return kind;
  }

  public FieldDescriptor findFieldByTag(int tag) {
    return fieldsByTag.get(tag);
  }

  public FieldDescriptor findFieldByName(String name) {
    return fieldsByName.get(name);
  }

  /**
   * Resolves an enum value to its symbolic name.
   *
   * @param value the numeric value
   * @return the name, or {@code null} if this is not an enum or has no such value
   */
  public String findEnumName(int value) {
    return enumNames.get(value);
  }

  public Collection<FieldDescriptor> fields() {
    return Collections.unmodifiableCollection(fieldsByTag.values());
  }

  @Override
  public String toString() {
    return kind.name().toLowerCase() + " " + fullName;
  }
}

package io.protoargs.parser.internal_api.metadata;

import io.protoargs.parser.api.WireFormatException;
import io.protoargs.parser.internal_api.ProtoDecoder;
import io.protoargs.parser.internal_api.WireField;
import java.nio.ByteBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a serialized {@code google.protobuf.FileDescriptorSet} into a {@link DescriptorPool}.
 *
 * <p>Only the parts of {@code descriptor.proto} needed for argument parsing are read; options,
 * services and source info are skipped.
 */
final class DescriptorSetLoader {
  private static final Logger log = LoggerFactory.getLogger(DescriptorSetLoader.class);

  // FileDescriptorSet
  private static final int SET_FILE = 1;
  // FileDescriptorProto
  private static final int FILE_PACKAGE = 2;
  private static final int FILE_MESSAGE_TYPE = 4;
  private static final int FILE_ENUM_TYPE = 5;
  private static final int FILE_EXTENSION = 7;
  // DescriptorProto
  private static final int MESSAGE_NAME = 1;
  private static final int MESSAGE_FIELD = 2;
  private static final int MESSAGE_NESTED_TYPE = 3;
  private static final int MESSAGE_ENUM_TYPE = 4;
  private static final int MESSAGE_EXTENSION = 6;
  // FieldDescriptorProto
  private static final int FIELD_NAME = 1;
  private static final int FIELD_EXTENDEE = 2;
  private static final int FIELD_NUMBER = 3;
  private static final int FIELD_LABEL = 4;
  private static final int FIELD_TYPE = 5;
  private static final int FIELD_TYPE_NAME = 6;
  private static final int LABEL_REPEATED = 3;
  // EnumDescriptorProto / EnumValueDescriptorProto
  private static final int ENUM_NAME = 1;
  private static final int ENUM_VALUE = 2;
  private static final int ENUM_VALUE_NAME = 1;
  private static final int ENUM_VALUE_NUMBER = 2;

  private final DescriptorPool pool;
  private int files;
  private int types;
  private int extensions;

  DescriptorSetLoader(DescriptorPool pool) {
    this.pool = pool;
  }

  void load(ByteBuffer fileDescriptorSet) throws WireFormatException {
    ProtoDecoder decoder = new ProtoDecoder(fileDescriptorSet);
    for (WireField f = decoder.readField(); f != null; f = decoder.readField()) {
      if (f.tag() == SET_FILE) {
        loadFile(f.asBytes());
      }
    }
    log.debug(
        "Loaded {} types and {} extensions from {} files", types, extensions, files);
  }

  private void loadFile(ByteBuffer file) throws WireFormatException {
    files++;
    String pkg = "";
    // the package may follow the types in the encoding, so it is resolved in a first pass
    ProtoDecoder decoder = new ProtoDecoder(file);
    for (WireField f = decoder.readField(); f != null; f = decoder.readField()) {
      if (f.tag() == FILE_PACKAGE) {
        pkg = f.asString();
      }
    }
    decoder = new ProtoDecoder(file);
    for (WireField f = decoder.readField(); f != null; f = decoder.readField()) {
      switch (f.tag()) {
        case FILE_MESSAGE_TYPE:
          loadMessage(pkg, f.asBytes());
          break;
        case FILE_ENUM_TYPE:
          loadEnum(pkg, f.asBytes());
          break;
        case FILE_EXTENSION:
          loadExtension(f.asBytes());
          break;
        default:
          break;
      }
    }
  }

  private void loadMessage(String scope, ByteBuffer message) throws WireFormatException {
    String name = null;
    ProtoDecoder decoder = new ProtoDecoder(message);
    for (WireField f = decoder.readField(); f != null; f = decoder.readField()) {
      if (f.tag() == MESSAGE_NAME) {
        name = f.asString();
      }
    }
    if (name == null) {
      throw new WireFormatException("Message descriptor without a name", "scope " + scope);
    }
    String fullName = qualify(scope, name);
    ProtoDescriptor descriptor = ProtoDescriptor.message(fullName);
    decoder = new ProtoDecoder(message);
    for (WireField f = decoder.readField(); f != null; f = decoder.readField()) {
      switch (f.tag()) {
        case MESSAGE_FIELD:
          descriptor.addField(readField(f.asBytes(), false).field);
          break;
        case MESSAGE_NESTED_TYPE:
          loadMessage(fullName, f.asBytes());
          break;
        case MESSAGE_ENUM_TYPE:
          loadEnum(fullName, f.asBytes());
          break;
        case MESSAGE_EXTENSION:
          loadExtension(f.asBytes());
          break;
        default:
          break;
      }
    }
    pool.addDescriptor(descriptor);
    types++;
  }

  private void loadEnum(String scope, ByteBuffer enumType) throws WireFormatException {
    String name = null;
    ProtoDecoder decoder = new ProtoDecoder(enumType);
    for (WireField f = decoder.readField(); f != null; f = decoder.readField()) {
      if (f.tag() == ENUM_NAME) {
        name = f.asString();
      }
    }
    if (name == null) {
      throw new WireFormatException("Enum descriptor without a name", "scope " + scope);
    }
    ProtoDescriptor descriptor = ProtoDescriptor.enumType(qualify(scope, name));
    decoder = new ProtoDecoder(enumType);
    for (WireField f = decoder.readField(); f != null; f = decoder.readField()) {
      if (f.tag() == ENUM_VALUE) {
        readEnumValue(descriptor, f.asBytes());
      }
    }
    pool.addDescriptor(descriptor);
    types++;
  }

  private static void readEnumValue(ProtoDescriptor descriptor, ByteBuffer value)
      throws WireFormatException {
    String name = null;
    int number = 0;
    ProtoDecoder decoder = new ProtoDecoder(value);
    for (WireField f = decoder.readField(); f != null; f = decoder.readField()) {
      if (f.tag() == ENUM_VALUE_NAME) {
        name = f.asString();
      } else if (f.tag() == ENUM_VALUE_NUMBER) {
        number = f.asInt32();
      }
    }
    if (name != null) {
      descriptor.addEnumValue(number, name);
    }
  }

  private void loadExtension(ByteBuffer field) throws WireFormatException {
    ParsedField parsed = readField(field, true);
    if (parsed.extendee == null) {
      throw new WireFormatException(
          "Extension without extendee", "field " + parsed.field.name());
    }
    pool.addExtension(parsed.extendee, parsed.field);
    extensions++;
  }

  private static ParsedField readField(ByteBuffer field, boolean extension)
      throws WireFormatException {
    String name = null;
    String extendee = null;
    String typeName = null;
    int number = 0;
    int type = 0;
    boolean repeated = false;
    ProtoDecoder decoder = new ProtoDecoder(field);
    for (WireField f = decoder.readField(); f != null; f = decoder.readField()) {
      switch (f.tag()) {
        case FIELD_NAME:
          name = f.asString();
          break;
        case FIELD_EXTENDEE:
          extendee = f.asString();
          break;
        case FIELD_NUMBER:
          number = f.asInt32();
          break;
        case FIELD_LABEL:
          repeated = f.asInt32() == LABEL_REPEATED;
          break;
        case FIELD_TYPE:
          type = f.asInt32();
          break;
        case FIELD_TYPE_NAME:
          typeName = f.asString();
          break;
        default:
          break;
      }
    }
    if (name == null) {
      throw new WireFormatException("Field descriptor without a name", "number " + number);
    }
    return new ParsedField(
        new FieldDescriptor(name, number, type, typeName, repeated, extension), extendee);
  }

  private static String qualify(String scope, String name) {
    return scope.isEmpty() ? name : scope + "." + name;
  }

  private static final class ParsedField {
    final FieldDescriptor field;
    final String extendee;

    ParsedField(FieldDescriptor field, String extendee) {
      this.field = field;
      this.extendee = extendee;
    }
  }
}

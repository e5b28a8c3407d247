package io.protoargs.parser.internal_api.metadata;

import io.protoargs.parser.api.WireFormatException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of message and enum descriptors, looked up by full type name.
 *
 * <p>Names are stored without the leading dot used by protobuf for fully qualified references;
 * lookups accept either form. The pool is not synchronized. It may be shared between parsers on
 * different threads once it is no longer modified.
 */
public final class DescriptorPool {
  private final Map<String, ProtoDescriptor> descriptors = new HashMap<>();
  private final Map<String, List<FieldDescriptor>> pendingExtensions = new HashMap<>();

  /**
   * Adds a descriptor, replacing any descriptor with the same full name. Extensions registered
   * earlier for this name are attached to it, including those of a replaced message unless the new
   * descriptor declares the same field number itself.
   *
   * @param descriptor the descriptor
   * @return this pool
   */
  public DescriptorPool addDescriptor(ProtoDescriptor descriptor) {
    ProtoDescriptor replaced = descriptors.put(descriptor.fullName(), descriptor);
    if (replaced != null
        && replaced.kind() == ProtoDescriptor.Kind.MESSAGE
        && descriptor.kind() == ProtoDescriptor.Kind.MESSAGE) {
      for (FieldDescriptor field : replaced.fields()) {
        if (field.isExtension() && descriptor.findFieldByTag(field.number()) == null) {
          descriptor.addField(field);
        }
      }
    }
    List<FieldDescriptor> pending = pendingExtensions.remove(descriptor.fullName());
    if (pending != null) {
      for (FieldDescriptor extension : pending) {
        descriptor.addField(extension);
      }
    }
    return this;
  }

  /**
   * Registers an extension field of {@code extendee}. If the extendee is not known yet, the field
   * is attached as soon as it is added.
   *
   * @param extendee the full name of the extended message
   * @param field the extension field; it is marked as an extension if it is not already
   * @return this pool
   */
  public DescriptorPool addExtension(String extendee, FieldDescriptor field) {
    FieldDescriptor extension = field.isExtension() ? field : field.asExtension();
    String name = normalizeName(extendee);
    ProtoDescriptor target = descriptors.get(name);
    if (target != null) {
      target.addField(extension);
    } else {
      pendingExtensions.computeIfAbsent(name, k -> new ArrayList<>()).add(extension);
    }
    return this;
  }

  /**
   * Loads all messages, enums and extensions of a serialized {@code
   * google.protobuf.FileDescriptorSet}.
   *
   * @param fileDescriptorSet the encoded descriptor set
   * @return this pool
   * @throws WireFormatException if the descriptor set is malformed
   */
  public DescriptorPool addFromFileDescriptorSet(ByteBuffer fileDescriptorSet)
      throws WireFormatException {
    new DescriptorSetLoader(this).load(fileDescriptorSet);
    return this;
  }

  /**
   * Finds a message or enum descriptor.
   *
   * @param name the full name, with or without a leading dot
   * @return the descriptor, or {@code null} if absent
   */
  public ProtoDescriptor findDescriptor(String name) {
    return name == null ? null : descriptors.get(normalizeName(name));
  }

  /**
   * Finds a message descriptor.
   *
   * @param name the full name, with or without a leading dot
   * @return the descriptor, or {@code null} if absent or not a message
   */
  public ProtoDescriptor findMessage(String name) {
    ProtoDescriptor descriptor = findDescriptor(name);
    return descriptor != null && descriptor.kind() == ProtoDescriptor.Kind.MESSAGE
        ? descriptor
        : null;
  }

  public int size() {
    return descriptors.size();
  }

  static String normalizeName(String name) {
    return name != null && name.startsWith(".") ? name.substring(1) : name;
  }
}

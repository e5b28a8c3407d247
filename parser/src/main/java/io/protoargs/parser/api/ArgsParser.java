package io.protoargs.parser.api;

import io.protoargs.parser.impl.ArgsParserImpl;
import io.protoargs.parser.internal_api.metadata.DescriptorPool;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.nio.ByteBuffer;

/**
 * Reflective decoder turning a protobuf-encoded message into a flat list of typed arguments.
 *
 * <p>The message type is resolved by name in a {@link DescriptorPool} at parse time, so no
 * generated classes are needed. Each scalar leaf is reported to a {@link Delegate} under a
 * {@link Key} built from the chain of field names leading to it.
 *
 * <p>Instances keep the current key path as mutable state and are therefore not thread-safe. Use
 * one parser per thread, and do not call back into the same parser from a {@link Delegate} or a
 * {@link ParsingOverride}.
 *
 * <pre>{@code
 * ArgsParser parser = ArgsParser.create(pool);
 * parser.addParsingOverride("task.pid", (field, delegate) -> ...);
 * parser.parseMessage(bytes, "my.pkg.TraceEvent", delegate);
 * }</pre>
 */
public interface ArgsParser {

  /**
   * Creates a parser with {@link ArgsParserOptions#defaults() default options}.
   *
   * @param pool the descriptor pool used to resolve type names
   * @return a new parser
   */
  static ArgsParser create(DescriptorPool pool) {
    return create(pool, ArgsParserOptions.defaults());
  }

  /**
   * Creates a parser.
   *
   * @param pool the descriptor pool used to resolve type names
   * @param options the parser options
   * @return a new parser
   */
  static ArgsParser create(DescriptorPool pool, ArgsParserOptions options) {
    return new ArgsParserImpl(pool, options);
  }

  /**
   * Registers a handler which replaces the default decoding of the field at {@code flatKey}.
   * Matching is by exact string; a later registration for the same path replaces the earlier one.
   * Overrides must be registered before parsing starts.
   *
   * @param flatKey the dotted path without repeated indices, e.g. {@code "task.args.pid"}
   * @param override the handler
   */
  void addParsingOverride(String flatKey, ParsingOverride override);

  /**
   * Decodes one message and reports its fields to the delegate.
   *
   * @param bytes the encoded message, from its position to its limit; the buffer is not modified
   * @param typeName the full message type name, with or without a leading dot
   * @param allowedTags top-level tags to decode, or {@code null} for all; extensions are always
   *     decoded and nested messages are never filtered
   * @param delegate the sink for the decoded arguments
   * @throws SchemaNotFoundException if {@code typeName} (or a nested message type) is unknown
   * @throws UnsupportedFieldTypeException if a field has a type with no argument representation
   * @throws WireFormatException if the payload is malformed
   * @throws NestingTooDeepException if nesting exceeds {@link ArgsParserOptions#maxNestingDepth()}
   * @throws ArgsParseException if a parsing override fails
   */
  void parseMessage(ByteBuffer bytes, String typeName, IntSet allowedTags, Delegate delegate)
      throws ArgsParseException;

  /**
   * Decodes one message without a tag allowlist.
   *
   * @param bytes the encoded message
   * @param typeName the full message type name
   * @param delegate the sink for the decoded arguments
   * @throws ArgsParseException on the first fatal error
   * @see #parseMessage(ByteBuffer, String, IntSet, Delegate)
   */
  default void parseMessage(ByteBuffer bytes, String typeName, Delegate delegate)
      throws ArgsParseException {
    parseMessage(bytes, typeName, null, delegate);
  }

  /**
   * Decodes one message held in a byte array.
   *
   * @param bytes the encoded message
   * @param typeName the full message type name
   * @param allowedTags top-level tags to decode, or {@code null} for all
   * @param delegate the sink for the decoded arguments
   * @throws ArgsParseException on the first fatal error
   * @see #parseMessage(ByteBuffer, String, IntSet, Delegate)
   */
  default void parseMessage(byte[] bytes, String typeName, IntSet allowedTags, Delegate delegate)
      throws ArgsParseException {
    parseMessage(ByteBuffer.wrap(bytes), typeName, allowedTags, delegate);
  }
}

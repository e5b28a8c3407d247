package io.protoargs.parser.api;

import io.protoargs.parser.internal_api.WireField;

/**
 * Custom handler for one exact flat argument path.
 *
 * <p>A registered override owns the whole field: the parser neither emits the field nor recurses
 * into it when it is a nested message. A handler cannot hand the field back to default decoding:
 * returning normally means the field is done, even if nothing was emitted for it.
 *
 * <p>The handler must not block and must not keep the {@link WireField} beyond the call, since it
 * may be a view over the caller's buffer.
 */
@FunctionalInterface
public interface ParsingOverride {
  /**
   * Handles one occurrence of the field.
   *
   * @param field the raw wire field
   * @param delegate the delegate of the current parse
   * @throws ArgsParseException to fail the whole parse; it reaches the caller of {@link
   *     ArgsParser#parseMessage} unchanged
   */
  void handle(WireField field, Delegate delegate) throws ArgsParseException;
}

/**
 * Public API of the schema-driven argument parser.
 *
 * <p><b>Model</b>
 *
 * <ul>
 *   <li>{@link io.protoargs.parser.api.ArgsParser} decodes a message whose type is known only by
 *       name, using a {@link io.protoargs.parser.internal_api.metadata.DescriptorPool}.
 *   <li>Every scalar leaf is reported to a {@link io.protoargs.parser.api.Delegate} with a {@link
 *       io.protoargs.parser.api.Key}, e.g. {@code key = "child.items[1].name"}, {@code flatKey =
 *       "child.items.name"}.
 *   <li>{@link io.protoargs.parser.api.ParsingOverride}s replace the decoding of one exact flat
 *       key.
 * </ul>
 *
 * <p><b>Errors</b>
 *
 * <p>All failures are {@link io.protoargs.parser.api.ArgsParseException}s. The first failure
 * aborts the parse; arguments already emitted stay with the delegate. Unknown tags, disallowed
 * tags and unresolvable enum values are not errors.
 */
package io.protoargs.parser.api;

package io.protoargs.parser.api;

/**
 * Sink receiving the typed arguments produced by {@link ArgsParser}.
 *
 * <p>Callbacks are invoked synchronously on the parsing thread, in wire order. Every call gets a
 * fresh {@link Key} snapshot which the delegate may keep.
 */
public interface Delegate {
  /**
   * Called for signed integer fields, and for enum values without a symbolic name.
   *
   * @param key the argument path
   * @param value the value
   */
  void addInteger(Key key, long value);

  /**
   * Called for {@code uint32} and {@code uint64} fields.
   *
   * @param key the argument path
   * @param value the value, to be interpreted as unsigned (see {@link Long#toUnsignedString(long)})
   */
  void addUnsignedInteger(Key key, long value);

  /**
   * Called for {@code bool} fields.
   *
   * @param key the argument path
   * @param value the value
   */
  void addBoolean(Key key, boolean value);

  /**
   * Called for {@code double} and {@code float} fields. Floats are widened.
   *
   * @param key the argument path
   * @param value the value
   */
  void addDouble(Key key, double value);

  /**
   * Called for {@code string} and {@code bytes} fields and for resolved enum symbols.
   *
   * @param key the argument path
   * @param value the value
   */
  void addString(Key key, String value);
}

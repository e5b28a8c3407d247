package io.protoargs.parser.impl;

import io.protoargs.parser.api.Delegate;
import io.protoargs.parser.api.Key;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delegate collecting the arguments of one or more messages into an insertion-ordered map keyed
 * by {@link Key#key()}.
 *
 * <p>Unsigned values above {@link Long#MAX_VALUE} are stored as {@link BigInteger}, all other
 * integers as {@link Long}.
 */
public final class MapDelegate implements Delegate {
  private final Map<String, Object> values = new LinkedHashMap<>();
  private final Map<String, String> flatKeys = new LinkedHashMap<>();

  @Override
  public void addInteger(Key key, long value) {
    put(key, value);
  }

  @Override
  public void addUnsignedInteger(Key key, long value) {
    put(key, value >= 0 ? (Object) value : new BigInteger(Long.toUnsignedString(value)));
  }

  @Override
  public void addBoolean(Key key, boolean value) {
    put(key, value);
  }

  @Override
  public void addDouble(Key key, double value) {
    put(key, value);
  }

  @Override
  public void addString(Key key, String value) {
    put(key, value);
  }

  private void put(Key key, Object value) {
    values.put(key.key(), value);
    flatKeys.put(key.key(), key.flatKey());
  }

  /**
   * Gets the collected arguments.
   *
   * @return an unmodifiable view, keyed by {@link Key#key()}
   */
  public Map<String, Object> values() {
    return Collections.unmodifiableMap(values);
  }

  /**
   * Gets the flat key under which an argument was reported.
   *
   * @param key the argument key
   * @return the flat key, or {@code null} if no argument was reported for {@code key}
   */
  public String flatKeyOf(String key) {
    return flatKeys.get(key);
  }

  public void clear() {
    values.clear();
    flatKeys.clear();
  }
}

package io.protoargs.parser.api;

import java.util.Objects;

/**
 * Immutable snapshot of an argument path.
 *
 * <p>{@link #flatKey()} is the dotted path made of bare field names. {@link #key()} is the same
 * path with a {@code [i]} suffix after every repeated field, e.g. {@code flatKey = "a.b.c"} and
 * {@code key = "a.b[2].c"}.
 */
public final class Key {
  private final String flatKey;
  private final String key;

  public Key(String key) {
    this(key, key);
  }

  public Key(String flatKey, String key) {
    this.flatKey = Objects.requireNonNull(flatKey, "flatKey");
    this.key = Objects.requireNonNull(key, "key");
  }

  /**
   * Gets the dotted path without repeated-field indices.
   *
   * @return the flat key
   */
  public String flatKey() {
    return flatKey;
  }

  /**
   * Gets the dotted path including repeated-field indices.
   *
   * @return the key
   */
  public String key() {
    return key;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Key other = (Key) o;
    return flatKey.equals(other.flatKey) && key.equals(other.key);
  }

  @Override
  public int hashCode() {
    return 31 * flatKey.hashCode() + key.hashCode();
  }

  @Override
  public String toString() {
    return flatKey.equals(key) ? key : key + " (" + flatKey + ")";
  }
}

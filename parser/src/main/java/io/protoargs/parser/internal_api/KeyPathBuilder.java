package io.protoargs.parser.internal_api;

import io.protoargs.parser.api.Key;

/**
 * Mutable dotted path tracking the field currently being decoded.
 *
 * <p>Keeps two buffers in lockstep: the {@code key} buffer, whose segments may carry a repeated
 * index ({@code items[3]}), and the {@code flat key} buffer, which only ever gets bare names.
 * Segments are appended with one of the {@code push} methods and removed again when the returned
 * {@link Scope} is closed, so every push should sit in a try-with-resources block:
 *
 * <pre>{@code
 * try (KeyPathBuilder.Scope k = path.pushKey("items[3]");
 *     KeyPathBuilder.Scope f = path.pushFlatKey("items")) {
 *   ...
 * }
 * }</pre>
 *
 * <p>Scopes must be closed in reverse order of creation.
 */
public final class KeyPathBuilder {
  private static final int DEFAULT_CAPACITY = 64;

  private final StringBuilder key = new StringBuilder(DEFAULT_CAPACITY);
  private final StringBuilder flatKey = new StringBuilder(DEFAULT_CAPACITY);

  /** Restores a path buffer to its length before the matching push. */
  public static final class Scope implements AutoCloseable {
    private final StringBuilder target;
    private final int oldLength;
    private boolean closed;

    private Scope(StringBuilder target, int oldLength) {
      this.target = target;
      this.oldLength = oldLength;
    }

    @Override
    public void close() {
      if (!closed) {
        closed = true;
        target.setLength(oldLength);
      }
    }
  }

  /**
   * Appends a segment to the key buffer only.
   *
   * @param segment the segment, possibly with a repeated index
   * @return the scope removing the segment again
   */
  public Scope pushKey(String segment) {
    return append(key, segment);
  }

  /**
   * Appends a segment to the flat key buffer only.
   *
   * @param segment the bare field name
   * @return the scope removing the segment again
   */
  public Scope pushFlatKey(String segment) {
    return append(flatKey, segment);
  }

  /**
   * Gets the current flat key without taking a snapshot.
   *
   * @return the current flat key
   */
  public String flatKey() {
    return flatKey.toString();
  }

  /**
   * Gets the current key without taking a snapshot.
   *
   * @return the current key
   */
  public String key() {
    return key.toString();
  }

  boolean isEmpty() {
    return key.length() == 0 && flatKey.length() == 0;
  }

  /**
   * Takes an immutable snapshot of both buffers.
   *
   * @return the current key
   */
  public Key snapshot() {
    return new Key(flatKey.toString(), key.toString());
  }

  private static Scope append(StringBuilder target, String segment) {
    int oldLength = target.length();
    if (oldLength != 0) {
      target.append('.');
    }
    target.append(segment);
    return new Scope(target, oldLength);
  }

  @Override
  public String toString() {
    return snapshot().toString();
  }
}

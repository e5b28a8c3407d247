package io.protoargs.parser;

import io.protoargs.parser.api.Delegate;
import io.protoargs.parser.api.Key;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Delegate remembering every emission in call order. */
public final class RecordingDelegate implements Delegate {

  /** One delegate call. */
  public static final class Emission {
    final String method;
    final Key key;
    final Object value;

    private Emission(String method, Key key, Object value) {
      this.method = method;
      this.key = key;
      this.value = value;
    }

    public static Emission integer(String key, String flatKey, long value) {
      return new Emission("addInteger", new Key(flatKey, key), value);
    }

    public static Emission unsigned(String key, String flatKey, long value) {
      return new Emission("addUnsignedInteger", new Key(flatKey, key), value);
    }

    public static Emission bool(String key, String flatKey, boolean value) {
      return new Emission("addBoolean", new Key(flatKey, key), value);
    }

    public static Emission dbl(String key, String flatKey, double value) {
      return new Emission("addDouble", new Key(flatKey, key), value);
    }

    public static Emission string(String key, String flatKey, String value) {
      return new Emission("addString", new Key(flatKey, key), value);
    }

    public Key key() {
      return key;
    }

    public Object value() {
      return value;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (!(o instanceof Emission)) return false;
      Emission other = (Emission) o;
      return method.equals(other.method)
          && key.equals(other.key)
          && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(method, key, value);
    }

    @Override
    public String toString() {
      return method + "(key=" + key.key() + ", flat_key=" + key.flatKey() + ", " + value + ")";
    }
  }

  private final List<Emission> emissions = new ArrayList<>();

  @Override
  public void addInteger(Key key, long value) {
    emissions.add(new Emission("addInteger", key, value));
  }

  @Override
  public void addUnsignedInteger(Key key, long value) {
    emissions.add(new Emission("addUnsignedInteger", key, value));
  }

  @Override
  public void addBoolean(Key key, boolean value) {
    emissions.add(new Emission("addBoolean", key, value));
  }

  @Override
  public void addDouble(Key key, double value) {
    emissions.add(new Emission("addDouble", key, value));
  }

  @Override
  public void addString(Key key, String value) {
    emissions.add(new Emission("addString", key, value));
  }

  public List<Emission> emissions() {
    return emissions;
  }
}

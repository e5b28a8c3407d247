package io.protoargs.parser.internal_api;

import static org.junit.jupiter.api.Assertions.*;

import io.protoargs.parser.api.Key;
import org.junit.jupiter.api.Test;

public class KeyPathBuilderTest {

  @Test
  public void testFirstSegmentHasNoDot() {
    KeyPathBuilder path = new KeyPathBuilder();
    try (KeyPathBuilder.Scope k = path.pushKey("a");
        KeyPathBuilder.Scope f = path.pushFlatKey("a")) {
      assertEquals(new Key("a", "a"), path.snapshot());
    }
    assertTrue(path.isEmpty());
  }

  @Test
  public void testNestedSegmentsAreDotted() {
    KeyPathBuilder path = new KeyPathBuilder();
    try (KeyPathBuilder.Scope k1 = path.pushKey("a[1]");
        KeyPathBuilder.Scope f1 = path.pushFlatKey("a")) {
      try (KeyPathBuilder.Scope k2 = path.pushKey("b");
          KeyPathBuilder.Scope f2 = path.pushFlatKey("b")) {
        assertEquals("a[1].b", path.key());
        assertEquals("a.b", path.flatKey());
      }
      assertEquals("a[1]", path.key());
      assertEquals("a", path.flatKey());
    }
    assertEquals("", path.key());
  }

  @Test
  public void testScopeRestoresOnException() {
    KeyPathBuilder path = new KeyPathBuilder();
    assertThrows(
        IllegalStateException.class,
        () -> {
          try (KeyPathBuilder.Scope k = path.pushKey("boom");
              KeyPathBuilder.Scope f = path.pushFlatKey("boom")) {
            throw new IllegalStateException();
          }
        });
    assertTrue(path.isEmpty());
  }

  @Test
  public void testSnapshotIsDetachedFromBuffers() {
    KeyPathBuilder path = new KeyPathBuilder();
    Key snapshot;
    try (KeyPathBuilder.Scope k = path.pushKey("x")) {
      snapshot = path.snapshot();
    }
    try (KeyPathBuilder.Scope k = path.pushKey("y")) {
      assertEquals("x", snapshot.key());
      assertEquals("", snapshot.flatKey());
    }
  }

  @Test
  public void testDoubleCloseIsHarmless() {
    KeyPathBuilder path = new KeyPathBuilder();
    KeyPathBuilder.Scope outer = path.pushKey("a");
    KeyPathBuilder.Scope inner = path.pushKey("b");
    inner.close();
    inner.close();
    assertEquals("a", path.key());
    outer.close();
    assertEquals("", path.key());
  }
}

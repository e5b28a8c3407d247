package io.protoargs.parser.internal_api.metadata;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

public class DescriptorPoolTest {

  @Test
  public void testLookupWithAndWithoutLeadingDot() {
    DescriptorPool pool = new DescriptorPool().addDescriptor(ProtoDescriptor.message(".a.B"));

    assertNotNull(pool.findMessage("a.B"));
    assertNotNull(pool.findMessage(".a.B"));
    assertEquals("a.B", pool.findDescriptor("a.B").fullName());
    assertNull(pool.findDescriptor("a"));
    assertNull(pool.findDescriptor(null));
  }

  @Test
  public void testFindMessageIgnoresEnums() {
    DescriptorPool pool = new DescriptorPool().addDescriptor(ProtoDescriptor.enumType("a.E"));

    assertNull(pool.findMessage("a.E"));
    assertNotNull(pool.findDescriptor("a.E"));
  }

  @Test
  public void testLastAddWins() {
    ProtoDescriptor first = ProtoDescriptor.message("a.B");
    ProtoDescriptor second = ProtoDescriptor.message("a.B");
    DescriptorPool pool = new DescriptorPool().addDescriptor(first).addDescriptor(second);

    assertSame(second, pool.findMessage("a.B"));
    assertEquals(1, pool.size());
  }

  @Test
  public void testExtensionAttachedToKnownMessage() {
    DescriptorPool pool = new DescriptorPool().addDescriptor(ProtoDescriptor.message("a.B"));
    pool.addExtension(".a.B", FieldDescriptor.scalar("ext", 10, FieldType.INT32));

    FieldDescriptor ext = pool.findMessage("a.B").findFieldByTag(10);
    assertNotNull(ext);
    assertTrue(ext.isExtension());
    assertSame(ext, pool.findMessage("a.B").findFieldByName("ext"));
  }

  @Test
  public void testExtensionHeldUntilExtendeeIsAdded() {
    DescriptorPool pool = new DescriptorPool();
    pool.addExtension("a.Later", FieldDescriptor.scalar("ext", 10, FieldType.INT32));
    assertNull(pool.findMessage("a.Later"));

    pool.addDescriptor(ProtoDescriptor.message("a.Later"));

    assertTrue(pool.findMessage("a.Later").findFieldByTag(10).isExtension());
  }

  @Test
  public void testReplacingFieldNumberDropsOldName() {
    ProtoDescriptor message =
        ProtoDescriptor.message("a.B")
            .addField(FieldDescriptor.scalar("old", 1, FieldType.INT32))
            .addField(FieldDescriptor.scalar("new", 1, FieldType.INT64));

    assertNull(message.findFieldByName("old"));
    assertEquals(FieldType.INT64, message.findFieldByTag(1).type());
    assertEquals(1, message.fields().size());
  }

  @Test
  public void testEnumAliasesKeepFirstName() {
    ProtoDescriptor e =
        ProtoDescriptor.enumType("a.E").addEnumValue(1, "ONE").addEnumValue(1, "UNO");

    assertEquals("ONE", e.findEnumName(1));
    assertNull(e.findEnumName(2));
  }

  @Test
  public void testKindMismatchRejected() {
    assertThrows(
        IllegalStateException.class,
        () -> ProtoDescriptor.enumType("a.E").addField(FieldDescriptor.scalar("f", 1, FieldType.BOOL)));
    assertThrows(
        IllegalStateException.class, () -> ProtoDescriptor.message("a.M").addEnumValue(1, "X"));
  }

  @Test
  public void testFieldDescriptorCopies() {
    FieldDescriptor base = FieldDescriptor.message("m", 3, ".pkg.Msg");
    FieldDescriptor repeatedExt = base.repeated().asExtension();

    assertEquals("pkg.Msg", base.resolvedTypeName());
    assertFalse(base.isRepeated());
    assertTrue(repeatedExt.isRepeated());
    assertTrue(repeatedExt.isExtension());
    assertEquals(FieldType.MESSAGE, repeatedExt.type());
    assertNull(new FieldDescriptor("x", 1, 99, null, false, false).type());
  }

  @Test
  public void testPackableTypes() {
    assertTrue(FieldType.SINT64.isPackable());
    assertTrue(FieldType.ENUM.isPackable());
    assertFalse(FieldType.STRING.isPackable());
    assertFalse(FieldType.MESSAGE.isPackable());
    assertNull(FieldType.fromId(0));
    assertNull(FieldType.fromId(19));
    assertEquals(FieldType.SINT64, FieldType.fromId(18));
  }
}

package io.protoargs.parser.impl;

import static org.assertj.core.api.Assertions.assertThat;

import io.protoargs.parser.ProtoWriter;
import io.protoargs.parser.RecordingDelegate;
import io.protoargs.parser.api.ArgsParseException;
import io.protoargs.parser.api.ArgsParser;
import io.protoargs.parser.api.Key;
import io.protoargs.parser.internal_api.metadata.DescriptorPool;
import io.protoargs.parser.internal_api.metadata.FieldDescriptor;
import io.protoargs.parser.internal_api.metadata.FieldType;
import io.protoargs.parser.internal_api.metadata.ProtoDescriptor;
import java.util.List;
import java.util.stream.Collectors;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import net.jqwik.api.constraints.StringLength;

/** Property-based checks of key path bookkeeping over randomly shaped messages. */
class ArgsParserPropertyTest {

  private static DescriptorPool pool() {
    return new DescriptorPool()
        .addDescriptor(
            ProtoDescriptor.message("test.M")
                .addField(FieldDescriptor.scalar("x", 1, FieldType.INT32))
                .addField(FieldDescriptor.scalar("y", 2, FieldType.STRING).repeated())
                .addField(FieldDescriptor.message("child", 3, "test.C").repeated()))
        .addDescriptor(
            ProtoDescriptor.message("test.C")
                .addField(FieldDescriptor.scalar("flag", 1, FieldType.BOOL))
                .addField(FieldDescriptor.scalar("tags", 2, FieldType.STRING).repeated()));
  }

  @Property
  void repeatedValuesAreIndexedInWireOrder(
      @ForAll @Size(max = 20) List<@AlphaChars @StringLength(max = 8) String> values)
      throws ArgsParseException {
    ProtoWriter writer = new ProtoWriter();
    values.forEach(v -> writer.string(2, v));
    RecordingDelegate delegate = new RecordingDelegate();

    ArgsParser.create(pool()).parseMessage(writer.toBuffer(), "test.M", delegate);

    assertThat(delegate.emissions()).hasSize(values.size());
    for (int i = 0; i < values.size(); i++) {
      RecordingDelegate.Emission e = delegate.emissions().get(i);
      assertThat(e.key()).isEqualTo(new Key("y", "y[" + i + "]"));
      assertThat(e.value()).isEqualTo(values.get(i));
    }
  }

  @Property
  void siblingFieldsNeverSeeEachOthersSegments(
      @ForAll @Size(max = 30) List<@IntRange(min = 0, max = 2) Integer> shape)
      throws ArgsParseException {
    ProtoWriter writer = new ProtoWriter();
    for (int kind : shape) {
      switch (kind) {
        case 0:
          writer.varint(1, 1);
          break;
        case 1:
          writer.string(2, "s");
          break;
        default:
          writer.message(3, new ProtoWriter().bool(1, true).string(2, "a").string(2, "b"));
          break;
      }
    }
    RecordingDelegate delegate = new RecordingDelegate();

    ArgsParser.create(pool()).parseMessage(writer.toBuffer(), "test.M", delegate);

    List<String> flatKeys =
        delegate.emissions().stream().map(e -> e.key().flatKey()).collect(Collectors.toList());
    assertThat(flatKeys).allMatch(k -> List.of("x", "y", "child.flag", "child.tags").contains(k));
    List<String> keys =
        delegate.emissions().stream().map(e -> e.key().key()).collect(Collectors.toList());
    assertThat(keys)
        .allMatch(k -> k.equals("x") || k.matches("y\\[\\d+]|child\\[\\d+]\\.(flag|tags\\[[01]])"));
    long children = shape.stream().filter(k -> k == 2).count();
    assertThat(keys.stream().filter(k -> k.endsWith(".flag")).count()).isEqualTo(children);
  }
}

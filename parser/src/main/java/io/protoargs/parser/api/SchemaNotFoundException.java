package io.protoargs.parser.api;

/** Thrown when a message type name has no entry in the descriptor pool. */
public class SchemaNotFoundException extends ArgsParseException {
  private final String typeName;

  /**
   * Constructs a new SchemaNotFoundException.
   *
   * @param typeName the type name that could not be resolved
   */
  public SchemaNotFoundException(String typeName) {
    super("Failed to find proto descriptor", typeName, SCHEMA_NOT_FOUND);
    this.typeName = typeName;
  }

  public String getTypeName() {
    return typeName;
  }
}

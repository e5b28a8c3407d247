package io.protoargs.parser.internal_api;

import io.protoargs.parser.api.ParsingOverride;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Parsing overrides keyed by exact flat key. */
public final class OverrideRegistry {
  private static final Logger log = LoggerFactory.getLogger(OverrideRegistry.class);

  private final Map<String, ParsingOverride> overrides = new HashMap<>();

  /**
   * Registers an override. A previous override for the same path is replaced.
   *
   * @param flatKey the exact flat key
   * @param override the handler
   */
  public void register(String flatKey, ParsingOverride override) {
    Objects.requireNonNull(flatKey, "flatKey");
    Objects.requireNonNull(override, "override");
    if (overrides.put(flatKey, override) != null) {
      log.debug("Replaced parsing override for '{}'", flatKey);
    }
  }

  /**
   * Looks up an override. No prefix or wildcard matching is done.
   *
   * @param flatKey the flat key of the current field
   * @return the override, or {@code null} if none is registered
   */
  public ParsingOverride lookup(String flatKey) {
    return overrides.isEmpty() ? null : overrides.get(flatKey);
  }

  public boolean isEmpty() {
    return overrides.isEmpty();
  }

  int size() {
    return overrides.size();
  }
}

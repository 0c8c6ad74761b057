package com.flamingo.ai.xmlrag.service.xml.registry;

import com.flamingo.ai.xmlrag.exception.DuplicateHandlerException;
import com.flamingo.ai.xmlrag.service.xml.handler.FormatHandler;
import com.flamingo.ai.xmlrag.service.xml.handler.HandlerDescriptor;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Append-only table of the handlers the dispatcher chooses from.
 *
 * <p>Registration happens once, during start-up, and ends with {@link #seal()}. After sealing the
 * registry is read-only: {@link #all()} returns the same immutable snapshot to every caller, so
 * concurrent classifications need no locking. Registering after sealing fails.
 *
 * <p>Instances are plain objects: the application builds one in {@link
 * com.flamingo.ai.xmlrag.config.HandlerRegistryConfig}, tests build isolated ones with synthetic
 * handlers.
 */
@Slf4j
public class HandlerRegistry {

  private final List<RegisteredHandler> handlers = new ArrayList<>();
  private final Map<String, RegisteredHandler> byId = new HashMap<>();
  private volatile List<RegisteredHandler> snapshot = List.of();
  private volatile boolean sealed;

  /**
   * Registers a handler at the next registration index.
   *
   * @param descriptor handler to add
   * @return the registered entry
   * @throws DuplicateHandlerException if a handler with the same id is already registered
   * @throws IllegalStateException if the registry has been sealed
   */
  public synchronized RegisteredHandler register(HandlerDescriptor descriptor) {
    if (sealed) {
      throw new IllegalStateException(
          "Handler registry is sealed; cannot register " + descriptor.id());
    }
    if (byId.containsKey(descriptor.id())) {
      throw new DuplicateHandlerException(descriptor.id());
    }
    RegisteredHandler entry = new RegisteredHandler(descriptor, handlers.size());
    handlers.add(entry);
    byId.put(descriptor.id(), entry);
    snapshot = List.copyOf(handlers);
    log.debug(
        "Registered handler {} (priority={}, index={})",
        descriptor.id(),
        descriptor.priority(),
        entry.registrationIndex());
    return entry;
  }

  public RegisteredHandler register(FormatHandler handler) {
    return register(handler.descriptor());
  }

  /** Ends the registration phase. Idempotent. */
  public synchronized void seal() {
    sealed = true;
  }

  public boolean isSealed() {
    return sealed;
  }

  /** Every registered handler, in registration order. */
  public List<RegisteredHandler> all() {
    return snapshot;
  }

  public Optional<RegisteredHandler> find(String id) {
    return snapshot.stream().filter(h -> h.id().equals(id)).findFirst();
  }

  public int size() {
    return snapshot.size();
  }
}

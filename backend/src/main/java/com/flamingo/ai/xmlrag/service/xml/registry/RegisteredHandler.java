package com.flamingo.ai.xmlrag.service.xml.registry;

import com.flamingo.ai.xmlrag.service.xml.handler.HandlerDescriptor;

/**
 * A handler descriptor together with its position in the registry.
 *
 * @param descriptor the registered descriptor
 * @param registrationIndex 0 for the first handler registered, 1 for the next, …
 */
public record RegisteredHandler(HandlerDescriptor descriptor, int registrationIndex) {

  public String id() {
    return descriptor.id();
  }

  public int priority() {
    return descriptor.priority();
  }
}

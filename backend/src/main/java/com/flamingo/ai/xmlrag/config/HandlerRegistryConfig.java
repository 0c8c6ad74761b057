package com.flamingo.ai.xmlrag.config;

import com.flamingo.ai.xmlrag.service.xml.handler.FormatHandler;
import com.flamingo.ai.xmlrag.service.xml.registry.HandlerRegistry;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the process-wide {@link HandlerRegistry}.
 *
 * <p>Spring injects the {@link FormatHandler} beans sorted by {@code @Order}; that order becomes
 * the registration order used as the last tie-break. The registry is sealed before the bean is
 * published, so no classification can observe a half-built registry.
 */
@Configuration
@Slf4j
public class HandlerRegistryConfig {

  @Bean
  public HandlerRegistry handlerRegistry(List<FormatHandler> handlers) {
    HandlerRegistry registry = new HandlerRegistry();
    handlers.forEach(registry::register);
    registry.seal();
    log.info(
        "Handler registry sealed with {} handlers: {}",
        registry.size(),
        registry.all().stream().map(h -> h.id()).toList());
    return registry;
  }
}

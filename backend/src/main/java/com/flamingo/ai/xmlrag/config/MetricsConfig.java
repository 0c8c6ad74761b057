package com.flamingo.ai.xmlrag.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics for the XML pipeline.
 *
 * <p>Counters and the {@code xml.chunks.produced} summary are recorded directly by the pipeline
 * components. The timers {@code xml.classify}, {@code xml.analyze}, {@code xml.chunk} and {@code
 * xml.process} come from {@code @Timed} on {@code XmlDocumentService} and need the aspect below;
 * a call that fails is tagged with the simple name of its exception.
 */
@Configuration
public class MetricsConfig {

  /**
   * Turns {@code @Timed} on the pipeline entry points into timers.
   *
   * @param registry registry the timers are published to
   * @return aspect that times the annotated service methods
   */
  @Bean
  public TimedAspect pipelineTimedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}

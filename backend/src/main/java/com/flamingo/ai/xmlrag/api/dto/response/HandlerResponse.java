package com.flamingo.ai.xmlrag.api.dto.response;

import com.flamingo.ai.xmlrag.service.xml.registry.RegisteredHandler;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a registered format handler. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HandlerResponse {

  private String id;
  private String displayName;
  private int priority;
  private int registrationIndex;

  public static HandlerResponse fromHandler(RegisteredHandler handler) {
    return HandlerResponse.builder()
        .id(handler.id())
        .displayName(handler.descriptor().displayName())
        .priority(handler.priority())
        .registrationIndex(handler.registrationIndex())
        .build();
  }
}

package com.gentoro.codex.model;

import java.util.List;

/**
 * Minimal abstraction over a Large Language Model provider.
 *
 * <p>Concrete providers live behind this interface and are selected via {@link LlmClientFactory}
 * from the {@link java.util.ServiceLoader} managed SPI {@link LlmClientProvider}.
 */
public interface LlmClient {

  /**
   * Runs one turn and returns the model's reply text.
   *
   * @throws com.gentoro.codex.exception.ExternalServiceException when the provider fails
   */
  String chat(List<Message> messages);

  /** Single user-message convenience for {@link #chat(List)}. */
  default String generate(String prompt) {
    return chat(List.of(new Message(Role.USER, prompt)));
  }

  enum Role {
    SYSTEM,
    ASSISTANT,
    USER
  }

  record Message(Role role, String content) {}
}

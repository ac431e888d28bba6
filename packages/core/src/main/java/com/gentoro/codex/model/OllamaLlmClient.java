package com.gentoro.codex.model;

import com.gentoro.codex.exception.ConfigException;
import com.gentoro.codex.exception.ExternalServiceException;
import com.gentoro.codex.exception.StateException;
import io.github.ollama4j.Ollama;
import io.github.ollama4j.exceptions.OllamaException;
import io.github.ollama4j.models.chat.OllamaChatMessageRole;
import io.github.ollama4j.models.chat.OllamaChatRequest;
import io.github.ollama4j.models.chat.OllamaChatResult;
import io.github.ollama4j.models.chat.OllamaChatStreamObserver;
import io.github.ollama4j.utils.Options;
import io.github.ollama4j.utils.OptionsBuilder;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/**
 * {@link LlmClient} for a local Ollama server, backed by ollama4j.
 *
 * <p>Keys: {@code baseUrl} (default {@code http://localhost:11434}), {@code model} (required),
 * {@code temperature} (default 0.2), {@code format} ({@code json} asks for a JSON reply), {@code
 * timeoutSeconds} (default 120).
 */
public class OllamaLlmClient extends AbstractLlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.codex.logging.LoggingService.getLogger(OllamaLlmClient.class);

  private final Ollama ollama;
  private final String model;

  public OllamaLlmClient(Configuration configuration) {
    this(configuration, createOllama(configuration));
  }

  public OllamaLlmClient(Configuration configuration, Ollama ollama) {
    super(configuration);
    this.ollama = ollama;
    this.model = configuration.getString("model", null);
    if (model == null || model.isBlank()) {
      throw new ConfigException("Ollama provider requires a 'model' setting");
    }
  }

  private static Ollama createOllama(Configuration configuration) {
    Ollama ollama = new Ollama(configuration.getString("baseUrl", "http://localhost:11434"));
    ollama.setRequestTimeoutSeconds(configuration.getLong("timeoutSeconds", 120L));
    return ollama;
  }

  @Override
  protected String runInference(List<Message> messages) throws Exception {
    Options options =
        new OptionsBuilder()
            .setTemperature((float) configuration.getDouble("temperature", 0.2))
            .build();

    OllamaChatRequest request =
        OllamaChatRequest.builder().withModel(model).withOptions(options);
    if ("json".equalsIgnoreCase(configuration.getString("format", ""))) {
      request.withGetJsonResponse();
    }
    messages.forEach(
        m ->
            request.withMessage(
                switch (m.role()) {
                  case SYSTEM -> OllamaChatMessageRole.SYSTEM;
                  case USER -> OllamaChatMessageRole.USER;
                  case ASSISTANT -> OllamaChatMessageRole.ASSISTANT;
                  default -> throw new StateException("Unknown message role: " + m.role());
                },
                m.content()));

    OllamaChatStreamObserver observer = new OllamaChatStreamObserver();
    observer.setThinkingStreamHandler(token -> log.trace("thinking: {}", token));
    observer.setResponseStreamHandler(token -> log.trace("response: {}", token));

    OllamaChatResult result;
    try {
      result = ollama.chat(request.build(), observer);
    } catch (OllamaException e) {
      throw new ExternalServiceException("Ollama chat request failed for model " + model, e);
    }
    if (result == null
        || result.getResponseModel() == null
        || result.getResponseModel().getMessage() == null
        || result.getResponseModel().getMessage().getResponse() == null) {
      throw new ExternalServiceException("Ollama response has no message content");
    }
    log.debug(
        "Ollama model {} answered, prompt tokens {}",
        model,
        result.getResponseModel().getPromptEvalCount());
    return result.getResponseModel().getMessage().getResponse();
  }
}

package com.gentoro.codex.model;

import com.gentoro.codex.exception.CodexException;
import com.gentoro.codex.exception.ExternalServiceException;
import java.util.List;
import org.apache.commons.configuration2.Configuration;

/**
 * Base {@link LlmClient} with common plumbing: timing, trace logging and wrapping provider
 * failures into {@link ExternalServiceException}. Subclasses implement {@link
 * #runInference(List)}.
 */
public abstract class AbstractLlmClient implements LlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.codex.logging.LoggingService.getLogger(AbstractLlmClient.class);
  protected final Configuration configuration;

  protected AbstractLlmClient(Configuration configuration) {
    this.configuration = configuration;
  }

  @Override
  public String chat(List<Message> messages) {
    log.trace("chat() called with {} message(s)", messages.size());
    long start = System.currentTimeMillis();
    try {
      return runInference(messages);
    } catch (CodexException e) {
      throw e;
    } catch (Exception e) {
      throw new ExternalServiceException(
          "There was a problem while running the inference with the chosen model.", e);
    } finally {
      log.debug("Inference completed in {} ms", System.currentTimeMillis() - start);
    }
  }

  protected abstract String runInference(List<Message> messages) throws Exception;
}

package com.gentoro.codex;

public class CodexApp {

  private static final org.slf4j.Logger log =
      com.gentoro.codex.logging.LoggingService.getLogger(CodexApp.class);

  public static void main(String[] args) {
    Codex app = null;
    int exitCode = 0;
    try {
      app = new Codex(args);
      app.initialize();
      app.run();
    } catch (Exception e) {
      log.error("Codex run failed", e);
      exitCode = 1;
    } finally {
      if (app != null) {
        app.shutdown();
      }
    }
    if (exitCode != 0) {
      System.exit(exitCode);
    }
  }
}

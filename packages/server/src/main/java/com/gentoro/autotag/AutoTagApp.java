package com.gentoro.autotag;

public class AutoTagApp {

  private static final org.slf4j.Logger log =
      com.gentoro.autotag.logging.LoggingService.getLogger(AutoTagApp.class);

  public static void main(String[] args) {
    try {
      AutoTag app = new AutoTag(args);
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}

package com.gentoro.nanobot;

public class NanobotApp {

  private static final org.slf4j.Logger log =
      com.gentoro.nanobot.logging.LoggingService.getLogger(NanobotApp.class);

  public static void main(String[] args) {
    try {
      Nanobot app = new Nanobot(args);
      app.initialize();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}

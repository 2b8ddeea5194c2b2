package com.gentoro.tldr;

import com.gentoro.tldr.logging.LoggingService;
import org.slf4j.Logger;

public class TldrApp {
  private static final Logger log = LoggingService.getLogger(TldrApp.class);

  public static void main(String[] args) {
    try {
      Tldr app = new Tldr(args);
      app.initialize();
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}

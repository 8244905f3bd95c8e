package com.gentoro.meshrender;

public class MeshRenderApp {

  private static final org.slf4j.Logger log =
      com.gentoro.meshrender.logging.LoggingService.getLogger(MeshRenderApp.class);

  public static void main(String[] args) {
    try {
      MeshRender app = new MeshRender(args);
      app.initialize();
      // Keep the server running until shutdown signal
      app.waitShutdownSignal();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}

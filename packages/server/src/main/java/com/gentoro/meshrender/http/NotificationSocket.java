package com.gentoro.meshrender.http;

import com.gentoro.meshrender.notify.CorrelationRegistry;
import com.gentoro.meshrender.notify.JobActivator;
import com.gentoro.meshrender.notify.NotificationSession;
import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketClose;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketError;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketMessage;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketOpen;
import org.eclipse.jetty.websocket.api.annotations.WebSocket;
import org.slf4j.Logger;

/**
 * WebSocket endpoint at {@code /ws}. One instance per connection; all protocol logic lives in
 * {@link NotificationSession}.
 */
@WebSocket
public class NotificationSocket {
  private static final Logger log =
      com.gentoro.meshrender.logging.LoggingService.getLogger(NotificationSocket.class);

  private final CorrelationRegistry registry;
  private final JobActivator activator;
  private volatile NotificationSession session;

  public NotificationSocket(CorrelationRegistry registry, JobActivator activator) {
    this.registry = registry;
    this.activator = activator;
  }

  @OnWebSocketOpen
  public void onOpen(Session wsSession) {
    JettyNotificationChannel channel = new JettyNotificationChannel(wsSession);
    NotificationSession s = new NotificationSession(channel, registry, activator);
    channel.bind(s);
    session = s;
    log.debug("WebSocket opened from {}", channel.describe());
  }

  @OnWebSocketMessage
  public void onMessage(String text) {
    NotificationSession s = session;
    if (s != null) s.onText(text);
  }

  @OnWebSocketClose
  public void onClose(int statusCode, String reason) {
    NotificationSession s = session;
    if (s != null) s.onClose(statusCode, reason);
  }

  @OnWebSocketError
  public void onError(Throwable cause) {
    NotificationSession s = session;
    if (s != null) {
      s.onError(cause);
    } else {
      log.warn("WebSocket failed before opening: {}", cause.toString());
    }
  }
}

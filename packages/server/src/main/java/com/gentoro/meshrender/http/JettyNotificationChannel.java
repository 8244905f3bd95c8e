package com.gentoro.meshrender.http;

import com.gentoro.meshrender.notify.NotificationChannel;
import com.gentoro.meshrender.notify.NotificationSession;
import java.io.IOException;
import org.eclipse.jetty.websocket.api.Callback;
import org.eclipse.jetty.websocket.api.Session;

/** {@link NotificationChannel} over a Jetty WebSocket {@link Session}. */
final class JettyNotificationChannel implements NotificationChannel {
  private final Session session;
  private volatile NotificationSession owner;

  JettyNotificationChannel(Session session) {
    this.session = session;
  }

  void bind(NotificationSession owner) {
    this.owner = owner;
  }

  @Override
  public String describe() {
    return String.valueOf(session.getRemoteSocketAddress());
  }

  @Override
  public boolean isOpen() {
    return session.isOpen();
  }

  @Override
  public void send(String text) throws IOException {
    if (!session.isOpen()) {
      throw new IOException("WebSocket is closed");
    }
    session.sendText(text, Callback.from(() -> {}, this::sendFailed));
  }

  @Override
  public void close(int statusCode, String reason) {
    if (session.isOpen()) {
      session.close(statusCode, reason, Callback.NOOP);
    }
  }

  private void sendFailed(Throwable cause) {
    NotificationSession s = owner;
    if (s != null) s.onError(cause);
  }
}

package com.gentoro.meshrender.notify;

/**
 * Lifecycle of a notification channel.
 *
 * <pre>
 * OPENED -> REGISTERED -> NOTIFIED -> TERMINAL -> CLOSED
 * </pre>
 *
 * <p>{@code REGISTERED -> TERMINAL} is allowed when the processing message was skipped. Any state
 * may move to {@code CLOSED}; nothing leaves it.
 */
public enum ChannelState {
  OPENED,
  REGISTERED,
  NOTIFIED,
  TERMINAL,
  CLOSED;

  boolean canTransitionTo(ChannelState next) {
    if (next == CLOSED) return this != CLOSED;
    return switch (this) {
      case OPENED -> next == REGISTERED;
      case REGISTERED -> next == OPENED || next == NOTIFIED || next == TERMINAL;
      case NOTIFIED -> next == TERMINAL;
      case TERMINAL, CLOSED -> false;
    };
  }
}

package io.courier.spi;

import java.io.IOException;

/**
 * Signals that a channel or its connection shut down while in use. Internal to the
 * messaging layer: consumers react by reconnecting, publish callers never see it.
 */
public class ConnectionLostException extends IOException {
  public ConnectionLostException(String message) {
    super(message);
  }

  public ConnectionLostException(String message, Throwable cause) {
    super(message, cause);
  }
}

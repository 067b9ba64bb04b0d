package io.courier.spring.boot;

import io.courier.Courier;

import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Starts the {@link Courier} once the context is refreshed and closes it when the context
 * stops. A closed courier cannot be restarted, so a stopped context must be recreated.
 */
public class CourierLifecycle implements SmartLifecycle {

  private final Courier courier;
  private volatile boolean running;

  public CourierLifecycle(Courier courier) {
    this.courier = Objects.requireNonNull(courier, "courier");
  }

  @Override
  public void start() {
    courier.start();
    running = true;
  }

  @Override
  public void stop() {
    running = false;
    courier.close();
  }

  @Override
  public boolean isRunning() {
    return running;
  }
}

package io.courier.rabbitmq;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import io.courier.spi.BrokerChannel;
import io.courier.spi.ConnectionLostException;
import io.courier.spi.Delivery;
import io.courier.spi.ExchangeType;
import io.courier.spi.OutboundMessage;

import java.io.IOException;
import java.util.Date;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BrokerChannel} over one AMQP channel.
 *
 * <p>The client library pushes deliveries on its own dispatch thread; they are buffered
 * here and handed out by {@link #nextDelivery(long)} on the consumer's thread, which is
 * the only thread that acks. A shutdown of the channel or connection wakes a blocked
 * {@code nextDelivery} through a marker entry.
 */
final class RabbitBrokerChannel implements BrokerChannel {
  private static final Logger logger = Logger.getLogger(RabbitBrokerChannel.class.getName());

  private static final int PERSISTENT = 2;
  private static final Delivery SHUTDOWN_MARKER = new Delivery(-1L, new byte[0], null, false);

  private final Channel channel;
  private final BlockingQueue<Delivery> deliveries = new LinkedBlockingQueue<>();
  private volatile String consumerTag;
  private volatile ShutdownSignalException shutdownCause;
  private volatile boolean cancelled;

  RabbitBrokerChannel(Channel channel) {
    this.channel = channel;
  }

  @Override
  public boolean isOpen() {
    return channel.isOpen();
  }

  @Override
  public void declareExchange(String exchange, ExchangeType type, boolean durable) throws IOException {
    try {
      channel.exchangeDeclare(exchange, type.wireName(), durable);
    } catch (ShutdownSignalException e) {
      throw lost(e);
    }
  }

  @Override
  public void declareQueue(String queue, boolean durable) throws IOException {
    try {
      channel.queueDeclare(queue, durable, false, false, null);
    } catch (ShutdownSignalException e) {
      throw lost(e);
    }
  }

  @Override
  public void bindQueue(String queue, String exchange, String routingKey) throws IOException {
    try {
      channel.queueBind(queue, exchange, routingKey);
    } catch (ShutdownSignalException e) {
      throw lost(e);
    }
  }

  @Override
  public void setPrefetch(int count) throws IOException {
    try {
      channel.basicQos(count);
    } catch (ShutdownSignalException e) {
      throw lost(e);
    }
  }

  @Override
  public void publish(OutboundMessage message) throws IOException {
    AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
        .contentType(OutboundMessage.CONTENT_TYPE)
        .contentEncoding("utf-8")
        .deliveryMode(message.persistent() ? PERSISTENT : 1)
        .messageId(message.messageId())
        .timestamp(Date.from(message.timestamp()))
        .build();
    try {
      channel.basicPublish(message.exchange(), message.routingKey(), properties, message.body());
    } catch (ShutdownSignalException e) {
      throw lost(e);
    }
  }

  @Override
  public void startConsuming(String queue) throws IOException {
    if (consumerTag != null) {
      throw new IllegalStateException("Channel is already consuming with tag " + consumerTag);
    }
    try {
      consumerTag = channel.basicConsume(queue, false, new BufferingConsumer(channel));
    } catch (ShutdownSignalException e) {
      throw lost(e);
    }
  }

  @Override
  public Delivery nextDelivery(long timeoutMs) throws IOException, InterruptedException {
    if (consumerTag == null) {
      throw new IOException("Channel is not consuming");
    }
    Delivery delivery = deliveries.poll(timeoutMs, TimeUnit.MILLISECONDS);
    if (delivery == SHUTDOWN_MARKER) {
      deliveries.offer(SHUTDOWN_MARKER);
      throw stopped();
    }
    if (delivery == null && (shutdownCause != null || cancelled)) {
      throw stopped();
    }
    return delivery;
  }

  private IOException stopped() {
    ShutdownSignalException cause = shutdownCause;
    if (cause != null && !cause.isInitiatedByApplication()) {
      return lost(cause);
    }
    if (cancelled) {
      return new ConnectionLostException("Consumer " + consumerTag + " was cancelled by the broker");
    }
    return new IOException("Channel closed");
  }

  @Override
  public void ack(long deliveryTag) throws IOException {
    try {
      channel.basicAck(deliveryTag, false);
    } catch (ShutdownSignalException e) {
      throw lost(e);
    }
  }

  @Override
  public void nack(long deliveryTag, boolean requeue) throws IOException {
    try {
      channel.basicNack(deliveryTag, false, requeue);
    } catch (ShutdownSignalException e) {
      throw lost(e);
    }
  }

  @Override
  public void close() {
    if (!channel.isOpen()) {
      return;
    }
    try {
      channel.close();
    } catch (IOException | TimeoutException | ShutdownSignalException e) {
      logger.log(Level.FINE, "Error closing RabbitMQ channel", e);
    }
  }

  private static ConnectionLostException lost(ShutdownSignalException e) {
    return new ConnectionLostException("Broker channel shut down: " + e.getMessage(), e);
  }

  private final class BufferingConsumer extends DefaultConsumer {

    BufferingConsumer(Channel channel) {
      super(channel);
    }

    @Override
    public void handleDelivery(String tag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
      String messageId = properties != null ? properties.getMessageId() : null;
      deliveries.offer(new Delivery(envelope.getDeliveryTag(), body, messageId, envelope.isRedeliver()));
    }

    @Override
    public void handleCancel(String tag) {
      cancelled = true;
      deliveries.offer(SHUTDOWN_MARKER);
    }

    @Override
    public void handleShutdownSignal(String tag, ShutdownSignalException sig) {
      shutdownCause = sig;
      deliveries.offer(SHUTDOWN_MARKER);
    }
  }
}

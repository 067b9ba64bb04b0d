package io.courier.spring.boot;

import io.courier.Courier;
import io.courier.broker.Topology;
import io.courier.jdbc.ConnectionProvider;
import io.courier.jdbc.DataSourceConnectionProvider;
import io.courier.jdbc.session.SessionManager;
import io.courier.rabbitmq.RabbitBrokerConnectionFactory;
import io.courier.retry.ExponentialBackoffRetryPolicy;
import io.courier.retry.RetryPolicy;
import io.courier.spi.BrokerConnectionFactory;
import io.courier.spi.MetricsExporter;
import io.courier.util.JsonCodec;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the courier messaging layer.
 *
 * <p>Wires a {@link Courier} composite from a {@link BrokerConnectionFactory} (RabbitMQ from
 * {@code courier.rabbitmq.*} unless the application defines its own) and
 * {@link CourierProperties}. When a {@link DataSource} is present, also exposes a
 * {@link SessionManager} for scoped database sessions.
 *
 * <p>The courier starts with the application context, after every
 * {@link CourierListener @CourierListener} bean has been subscribed.
 *
 * @see CourierProperties
 * @see CourierMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Courier.class)
@EnableConfigurationProperties(CourierProperties.class)
public class CourierAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(BrokerConnectionFactory.class)
  public RabbitBrokerConnectionFactory brokerConnectionFactory(CourierProperties props) {
    CourierProperties.Rabbitmq rabbit = props.getRabbitmq();
    RabbitBrokerConnectionFactory.Builder builder = RabbitBrokerConnectionFactory.builder()
        .fromEnvironment(System.getenv())
        .heartbeatSeconds(rabbit.getHeartbeatSeconds())
        .connectionTimeoutMs(rabbit.getConnectionTimeoutMs())
        .clientName(rabbit.getClientName());
    if (rabbit.getHost() != null) {
      builder.host(rabbit.getHost());
    }
    if (rabbit.getPort() != null) {
      builder.port(rabbit.getPort());
    }
    if (rabbit.getVirtualHost() != null) {
      builder.virtualHost(rabbit.getVirtualHost());
    }
    if (rabbit.getUsername() != null) {
      builder.username(rabbit.getUsername());
    }
    if (rabbit.getPassword() != null) {
      builder.password(rabbit.getPassword());
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Courier courier(CourierProperties props,
      BrokerConnectionFactory connectionFactory,
      ObjectProvider<Topology> topologyProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<JsonCodec> codecProvider) {

    CourierProperties.Pool pool = props.getPool();
    CourierProperties.Publisher publisher = props.getPublisher();
    CourierProperties.Consumer consumer = props.getConsumer();

    var builder = Courier.builder()
        .connectionFactory(connectionFactory)
        .poolCapacity(pool.getCapacity())
        .poolMaxIdle(pool.getMaxIdle())
        .acquireTimeout(pool.getAcquireTimeout())
        .creationAttempts(pool.getCreationAttempts())
        .creationRetryPolicy(RetryPolicy.fixed(pool.getCreationRetryDelayMs()))
        .batchSize(publisher.getBatchSize())
        .idleIntervalMs(publisher.getIdleIntervalMs())
        .drainTimeoutMs(publisher.getDrainTimeoutMs())
        .publishRetryPolicy(new ExponentialBackoffRetryPolicy(
            publisher.getRetryBaseDelayMs(), publisher.getRetryMaxDelayMs()))
        .prefetch(consumer.getPrefetch())
        .maxDeliveryAttempts(consumer.getMaxDeliveryAttempts())
        .receiveTimeoutMs(consumer.getReceiveTimeoutMs())
        .reconnectPolicy(RetryPolicy.fixed(consumer.getReconnectDelayMs()));

    Topology topology = topologyProvider.getIfAvailable();
    if (topology != null) {
      builder.topology(topology);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    JsonCodec codec = codecProvider.getIfAvailable();
    if (codec != null) {
      builder.codec(codec);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public CourierListenerRegistrar courierListenerRegistrar(ListableBeanFactory beanFactory,
      Courier courier) {
    return new CourierListenerRegistrar(beanFactory, courier);
  }

  @Bean
  @ConditionalOnMissingBean
  public CourierLifecycle courierLifecycle(Courier courier) {
    return new CourierLifecycle(courier);
  }

  @Bean
  @ConditionalOnBean(DataSource.class)
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnBean(DataSource.class)
  @ConditionalOnMissingBean
  public SessionManager sessionManager(CourierProperties props,
      ConnectionProvider connectionProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {
    CourierProperties.Session session = props.getSession();
    SessionManager.Builder builder = SessionManager.builder()
        .connectionProvider(connectionProvider)
        .connectivityAttempts(session.getConnectivityAttempts())
        .connectivityRetryPolicy(RetryPolicy.fixed(session.getConnectivityRetryDelayMs()));
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    SessionManager manager = builder.build();
    if (session.isVerifyOnStartup()) {
      manager.verifyConnectivity();
    }
    return manager;
  }
}

package io.courier.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the courier messaging layer.
 *
 * @see CourierAutoConfiguration
 */
@ConfigurationProperties(prefix = "courier")
public class CourierProperties {

    private final Rabbitmq rabbitmq = new Rabbitmq();
    private final Pool pool = new Pool();
    private final Publisher publisher = new Publisher();
    private final Consumer consumer = new Consumer();
    private final Session session = new Session();
    private final Metrics metrics = new Metrics();

    public Rabbitmq getRabbitmq() {
        return rabbitmq;
    }

    public Pool getPool() {
        return pool;
    }

    public Publisher getPublisher() {
        return publisher;
    }

    public Consumer getConsumer() {
        return consumer;
    }

    public Session getSession() {
        return session;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Broker endpoint. Unset values fall back to the {@code RABBITMQ_*} environment
     * variables, then to the factory defaults.
     */
    public static class Rabbitmq {
        private String host;
        private Integer port;
        private String virtualHost;
        private String username;
        private String password;
        private int heartbeatSeconds = 600;
        private int connectionTimeoutMs = 10000;
        private String clientName = "courier";

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public Integer getPort() {
            return port;
        }

        public void setPort(Integer port) {
            this.port = port;
        }

        public String getVirtualHost() {
            return virtualHost;
        }

        public void setVirtualHost(String virtualHost) {
            this.virtualHost = virtualHost;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public int getHeartbeatSeconds() {
            return heartbeatSeconds;
        }

        public void setHeartbeatSeconds(int heartbeatSeconds) {
            this.heartbeatSeconds = heartbeatSeconds;
        }

        public int getConnectionTimeoutMs() {
            return connectionTimeoutMs;
        }

        public void setConnectionTimeoutMs(int connectionTimeoutMs) {
            this.connectionTimeoutMs = connectionTimeoutMs;
        }

        public String getClientName() {
            return clientName;
        }

        public void setClientName(String clientName) {
            this.clientName = clientName;
        }
    }

    public static class Pool {
        private int capacity = 20;
        private int maxIdle = -1;
        private Duration acquireTimeout = Duration.ofSeconds(30);
        private int creationAttempts = 5;
        private long creationRetryDelayMs = 2000;

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }

        public int getMaxIdle() {
            return maxIdle;
        }

        public void setMaxIdle(int maxIdle) {
            this.maxIdle = maxIdle;
        }

        public Duration getAcquireTimeout() {
            return acquireTimeout;
        }

        public void setAcquireTimeout(Duration acquireTimeout) {
            this.acquireTimeout = acquireTimeout;
        }

        public int getCreationAttempts() {
            return creationAttempts;
        }

        public void setCreationAttempts(int creationAttempts) {
            this.creationAttempts = creationAttempts;
        }

        public long getCreationRetryDelayMs() {
            return creationRetryDelayMs;
        }

        public void setCreationRetryDelayMs(long creationRetryDelayMs) {
            this.creationRetryDelayMs = creationRetryDelayMs;
        }
    }

    public static class Publisher {
        private int batchSize = 50;
        private long idleIntervalMs = 100;
        private long drainTimeoutMs = 5000;
        private long retryBaseDelayMs = 200;
        private long retryMaxDelayMs = 5000;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getIdleIntervalMs() {
            return idleIntervalMs;
        }

        public void setIdleIntervalMs(long idleIntervalMs) {
            this.idleIntervalMs = idleIntervalMs;
        }

        public long getDrainTimeoutMs() {
            return drainTimeoutMs;
        }

        public void setDrainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
        }

        public long getRetryBaseDelayMs() {
            return retryBaseDelayMs;
        }

        public void setRetryBaseDelayMs(long retryBaseDelayMs) {
            this.retryBaseDelayMs = retryBaseDelayMs;
        }

        public long getRetryMaxDelayMs() {
            return retryMaxDelayMs;
        }

        public void setRetryMaxDelayMs(long retryMaxDelayMs) {
            this.retryMaxDelayMs = retryMaxDelayMs;
        }
    }

    public static class Consumer {
        private int prefetch = 1;
        private int maxDeliveryAttempts = 0;
        private long receiveTimeoutMs = 1000;
        private long reconnectDelayMs = 5000;

        public int getPrefetch() {
            return prefetch;
        }

        public void setPrefetch(int prefetch) {
            this.prefetch = prefetch;
        }

        public int getMaxDeliveryAttempts() {
            return maxDeliveryAttempts;
        }

        public void setMaxDeliveryAttempts(int maxDeliveryAttempts) {
            this.maxDeliveryAttempts = maxDeliveryAttempts;
        }

        public long getReceiveTimeoutMs() {
            return receiveTimeoutMs;
        }

        public void setReceiveTimeoutMs(long receiveTimeoutMs) {
            this.receiveTimeoutMs = receiveTimeoutMs;
        }

        public long getReconnectDelayMs() {
            return reconnectDelayMs;
        }

        public void setReconnectDelayMs(long reconnectDelayMs) {
            this.reconnectDelayMs = reconnectDelayMs;
        }
    }

    public static class Session {
        private boolean verifyOnStartup = false;
        private int connectivityAttempts = 5;
        private long connectivityRetryDelayMs = 2000;

        public boolean isVerifyOnStartup() {
            return verifyOnStartup;
        }

        public void setVerifyOnStartup(boolean verifyOnStartup) {
            this.verifyOnStartup = verifyOnStartup;
        }

        public int getConnectivityAttempts() {
            return connectivityAttempts;
        }

        public void setConnectivityAttempts(int connectivityAttempts) {
            this.connectivityAttempts = connectivityAttempts;
        }

        public long getConnectivityRetryDelayMs() {
            return connectivityRetryDelayMs;
        }

        public void setConnectivityRetryDelayMs(long connectivityRetryDelayMs) {
            this.connectivityRetryDelayMs = connectivityRetryDelayMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "courier";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}

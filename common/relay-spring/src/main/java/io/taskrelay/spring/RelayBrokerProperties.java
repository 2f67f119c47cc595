package io.taskrelay.spring;

import io.taskrelay.messaging.connection.BrokerConnectionSettings;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Broker connection settings ({@code taskrelay.broker.*}).
 */
@Validated
@ConfigurationProperties(prefix = "taskrelay.broker")
public class RelayBrokerProperties {

    @NotBlank
    private String host = "localhost";
    @Min(1)
    @Max(65535)
    private int port = 5672;
    @NotNull
    private String username = "guest";
    @NotNull
    private String password = "guest";
    @NotNull
    private String virtualHost = "/";
    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(5);
    @NotNull
    private Duration heartbeatInterval = Duration.ofSeconds(30);
    @NotNull
    private Duration retryDelay = Duration.ofSeconds(2);
    @Min(1)
    private int maxRetries = 5;
    @NotNull
    private Duration confirmTimeout = Duration.ofSeconds(5);

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
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

    public String getVirtualHost() {
        return virtualHost;
    }

    public void setVirtualHost(String virtualHost) {
        this.virtualHost = virtualHost;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public void setRetryDelay(Duration retryDelay) {
        this.retryDelay = retryDelay;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getConfirmTimeout() {
        return confirmTimeout;
    }

    public void setConfirmTimeout(Duration confirmTimeout) {
        this.confirmTimeout = confirmTimeout;
    }

    public BrokerConnectionSettings toSettings() {
        return new BrokerConnectionSettings(host, port, username, password, virtualHost, connectTimeout,
            heartbeatInterval, retryDelay, maxRetries, confirmTimeout);
    }
}

package ch.so.arp.recall.memory;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connection settings for the vector store cluster.
 */
@ConfigurationProperties(prefix = "recall.store")
public class StoreProperties {

    /**
     * REST endpoint of the cluster, for example {@code https://my-cluster.weaviate.cloud}.
     */
    private String url = "http://localhost:8080";

    /**
     * Admin API key of the cluster.
     */
    private String adminApiKey;

    /**
     * Interval between two readiness probes.
     */
    private Duration pollInterval = Duration.ofSeconds(2);

    /**
     * Upper bound for the readiness wait after a session has been opened.
     */
    private Duration readyTimeout = Duration.ofSeconds(60);

    private Duration queryTimeout = Duration.ofSeconds(120);

    private Duration insertTimeout = Duration.ofSeconds(30);

    private Duration initTimeout = Duration.ofSeconds(30);

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getAdminApiKey() {
        return adminApiKey;
    }

    public void setAdminApiKey(String adminApiKey) {
        this.adminApiKey = adminApiKey;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getReadyTimeout() {
        return readyTimeout;
    }

    public void setReadyTimeout(Duration readyTimeout) {
        this.readyTimeout = readyTimeout;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public void setQueryTimeout(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    public Duration getInsertTimeout() {
        return insertTimeout;
    }

    public void setInsertTimeout(Duration insertTimeout) {
        this.insertTimeout = insertTimeout;
    }

    public Duration getInitTimeout() {
        return initTimeout;
    }

    public void setInitTimeout(Duration initTimeout) {
        this.initTimeout = initTimeout;
    }
}

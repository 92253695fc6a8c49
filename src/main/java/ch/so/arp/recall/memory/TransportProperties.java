package ch.so.arp.recall.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the Discord transport.
 */
@ConfigurationProperties(prefix = "recall.transport")
public class TransportProperties {

    private String baseUrl = "https://discord.com/api/v10";

    /**
     * Bot token used for the {@code Authorization} header.
     */
    private String botToken;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getBotToken() {
        return botToken;
    }

    public void setBotToken(String botToken) {
        this.botToken = botToken;
    }
}

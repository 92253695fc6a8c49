package ch.so.arp.recall.memory;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Configuration of the model provider used for vectorization, store side
 * generation and client side completions.
 */
@ConfigurationProperties(prefix = "recall.completion")
public class CompletionProperties implements EnvironmentAware {

    /**
     * Model provider the service is bound to.
     */
    private ModelProvider provider = ModelProvider.MISTRAL;

    /**
     * API key of the provider. Falls back to the Spring AI property of the
     * selected provider.
     */
    private String apiKey;

    /**
     * Base URL of the completion API. Defaults to the public endpoint of the
     * provider.
     */
    private String baseUrl;

    /**
     * Chat model used for client side completions. Defaults to the provider's
     * small chat model.
     */
    private String model;

    private int maxTokens = 1024;

    private double temperature = 0.8d;

    private Environment environment;

    public ModelProvider getProvider() {
        return provider;
    }

    public void setProvider(ModelProvider provider) {
        this.provider = provider;
    }

    public String getApiKey() {
        if (StringUtils.hasText(apiKey)) {
            return apiKey;
        }
        if (environment == null) {
            return null;
        }
        return switch (provider) {
            case MISTRAL -> environment.getProperty("spring.ai.mistralai.api-key");
            case OPENAI -> environment.getProperty("spring.ai.openai.api-key");
        };
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return StringUtils.hasText(baseUrl) ? baseUrl : provider.completionBaseUrl();
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return StringUtils.hasText(model) ? model : provider.completionModel();
    }

    public void setModel(String model) {
        this.model = model;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    /**
     * @return the credentials every orchestrator of this service is bound to
     */
    public ProviderCredentials toCredentials() {
        String key = getApiKey();
        return new ProviderCredentials(provider, key != null ? key : "");
    }

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }
}

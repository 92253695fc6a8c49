package ch.so.arp.recall.memory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Model providers the vector store can call out to. Each provider has its own
 * authentication header and its own vectorizer and generative modules.
 */
public enum ModelProvider {

    MISTRAL("X-Mistral-Api-Key", "text2vec-mistral", "generative-mistral", "https://api.mistral.ai/v1",
            "mistral-small-latest") {
        @Override
        Map<String, Object> vectorizerConfig() {
            Map<String, Object> config = new LinkedHashMap<>();
            config.put("model", "mistral-embed");
            config.put("vectorizeClassName", true);
            return config;
        }

        @Override
        Map<String, Object> generativeConfig() {
            Map<String, Object> config = new LinkedHashMap<>();
            config.put("model", "mistral-small-latest");
            config.put("maxTokens", 1024);
            config.put("temperature", 0.8d);
            return config;
        }
    },
    OPENAI("X-Openai-Api-Key", "text2vec-openai", "generative-openai", "https://api.openai.com/v1",
            "gpt-3.5-turbo") {
        @Override
        Map<String, Object> vectorizerConfig() {
            Map<String, Object> config = new LinkedHashMap<>();
            config.put("model", "text-embedding-3-large");
            config.put("dimensions", 512);
            config.put("type", "text");
            config.put("vectorizeClassName", true);
            return config;
        }

        @Override
        Map<String, Object> generativeConfig() {
            Map<String, Object> config = new LinkedHashMap<>();
            config.put("model", "gpt-3.5-turbo");
            config.put("maxTokens", 1024);
            config.put("temperature", 0.8d);
            return config;
        }
    };

    private final String headerName;
    private final String vectorizerModule;
    private final String generativeModule;
    private final String completionBaseUrl;
    private final String completionModel;

    ModelProvider(String headerName, String vectorizerModule, String generativeModule, String completionBaseUrl,
            String completionModel) {
        this.headerName = headerName;
        this.vectorizerModule = vectorizerModule;
        this.generativeModule = generativeModule;
        this.completionBaseUrl = completionBaseUrl;
        this.completionModel = completionModel;
    }

    abstract Map<String, Object> vectorizerConfig();

    abstract Map<String, Object> generativeConfig();

    /**
     * @return the header carrying the provider key on requests to the vector store
     */
    public String headerName() {
        return headerName;
    }

    public String vectorizerModule() {
        return vectorizerModule;
    }

    public String completionBaseUrl() {
        return completionBaseUrl;
    }

    public String completionModel() {
        return completionModel;
    }

    /**
     * Module configuration attached to a new collection: the vectorizer and the
     * generative module of this provider.
     */
    public Map<String, Object> moduleConfig() {
        Map<String, Object> moduleConfig = new LinkedHashMap<>();
        moduleConfig.put(vectorizerModule, vectorizerConfig());
        moduleConfig.put(generativeModule, generativeConfig());
        return moduleConfig;
    }
}

package dev.quillbench.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Model defaults. {@code defaultModel} is used when the command line gives no {@code --model}.
 */
@ConfigurationProperties(prefix = "quillbench.ai")
public record AiProperties(String defaultModel, double temperature, int maxOutputTokens) {
    public AiProperties {
        if (defaultModel == null || defaultModel.isBlank()) defaultModel = "amazon.nova-pro-v1:0";
        if (temperature <= 0) temperature = 0.7;
        if (maxOutputTokens <= 0) maxOutputTokens = 2048;
    }
}

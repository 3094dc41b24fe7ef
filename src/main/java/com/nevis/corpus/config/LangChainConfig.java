package com.nevis.corpus.config;

import com.nevis.corpus.exception.MissingCredentialException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class LangChainConfig {

    @Value("${app.gemini.api-key:}")
    private String apiKey;

    @Value("${app.gemini.model:gemini-3-flash-preview}")
    private String modelName;

    @Value("${app.gemini.timeout-seconds:300}")
    private int timeoutSeconds;

    @Value("${app.gemini.temperature:0.3}")
    private double temperature;

    @Bean
    public ChatModel chatLanguageModel() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new MissingCredentialException("GEMINI_API_KEY");
        }

        return GoogleAiGeminiChatModel.builder()
            .apiKey(apiKey.trim())
            .modelName(modelName)
            .temperature(temperature)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .maxRetries(2)
            .build();
    }
}

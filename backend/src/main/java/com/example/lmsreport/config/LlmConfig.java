package com.example.lmsreport.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * ollama.enabled=true の場合のみChatModelを登録する。
 * Beanが無ければLocalLlmClientは「利用不可」として振る舞う。
 */
@Configuration
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "ollama", name = "enabled", havingValue = "true")
    public ChatModel ollamaChatModel(OllamaProperties properties) {
        log.info("Ollamaモデルを初期化します: model={}, baseUrl={}", properties.getModelName(), properties.getBaseUrl());
        return OllamaChatModel.builder()
                .baseUrl(properties.getBaseUrl())
                .modelName(properties.getModelName())
                .temperature(properties.getTemperature())
                .numPredict(properties.getNumPredict())
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                .build();
    }
}

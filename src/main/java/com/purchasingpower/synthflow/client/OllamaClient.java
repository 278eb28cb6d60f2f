package com.purchasingpower.synthflow.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Ollama LLM provider over the {@code /api/chat} endpoint.
 * Targets local code models so that multi-shot sampling has no per-call cost.
 */
@Slf4j
@Component
public class OllamaClient implements LLMProvider {

    private static final String SYSTEM_PROMPT =
            "You are a Java code generator. Reply with a single Java code block and nothing else.";

    private WebClient ollamaWebClient;

    @Value("${app.ollama.base-url:http://localhost:11434}")
    private String baseUrl;

    @Value("${app.ollama.chat-model:qwen2.5-coder:7b}")
    private String chatModel;

    @Value("${app.ollama.num-ctx:8192}")
    private int numCtx;

    @Value("${app.ollama.timeout-minutes:5}")
    private int timeoutMinutes;

    @PostConstruct
    public void init() {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10000)
                .responseTimeout(Duration.ofMinutes(timeoutMinutes))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutMinutes, TimeUnit.MINUTES))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutMinutes, TimeUnit.MINUTES)));

        this.ollamaWebClient = WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    public String getProviderName() {
        return "Ollama (" + chatModel + ")";
    }

    @Override
    public String chat(String prompt, double temperature, String caller) {
        log.info("🔵 [LLM REQUEST] Provider=Ollama, Caller={}, Model={}, Temperature={}", caller, chatModel, temperature);
        log.debug("🔵 [LLM REQUEST] Prompt length={}, First 200 chars: {}",
                prompt.length(),
                prompt.substring(0, Math.min(200, prompt.length())));

        long startTime = System.currentTimeMillis();

        Map<String, Object> body = Map.of(
                "model", chatModel,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", prompt)
                ),
                "stream", false,
                "options", Map.of(
                        "num_ctx", numCtx,
                        "temperature", temperature,
                        "num_predict", 2048
                )
        );

        try {
            JsonNode response = ollamaWebClient.post()
                    .uri("/api/chat")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();

            String content = response == null ? "" : response.path("message").path("content").asText();
            long latency = System.currentTimeMillis() - startTime;

            log.info("🟢 [LLM RESPONSE] Provider=Ollama, Latency={}ms, ResponseLength={}", latency, content.length());
            log.debug("🟢 [LLM RESPONSE] Content: {}", content.substring(0, Math.min(500, content.length())));
            return content;

        } catch (Exception e) {
            log.error("🔴 Ollama call failed for model {}: {}", chatModel, e.getMessage());
            throw new IllegalStateException("Local AI Engine (Ollama) failed. Ensure the " + chatModel
                    + " model is downloaded and Ollama is running.", e);
        }
    }
}

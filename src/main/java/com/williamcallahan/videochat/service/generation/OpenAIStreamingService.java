package com.williamcallahan.videochat.service.generation;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.http.StreamResponse;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionChunk;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.williamcallahan.videochat.config.AppProperties;
import com.williamcallahan.videochat.support.OpenAiSdkUrlNormalizer;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Chat completions against an OpenAI-compatible endpoint (Groq by default) through the OpenAI
 * Java SDK's native streaming support.
 */
@Service
public class OpenAIStreamingService {
    private static final Logger log = LoggerFactory.getLogger(OpenAIStreamingService.class);

    private final OpenAIClient client;
    private final AppProperties.Llm llm;

    @Autowired
    public OpenAIStreamingService(AppProperties appProperties) {
        this(buildClient(appProperties.getLlm()), appProperties.getLlm());
    }

    OpenAIStreamingService(OpenAIClient client, AppProperties.Llm llm) {
        this.client = client;
        this.llm = llm;
    }

    private static OpenAIClient buildClient(AppProperties.Llm llm) {
        if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
            log.warn("[LLM] No API key configured (LLM_API_KEY); generation will not be available");
            return null;
        }
        log.info("[LLM] Initializing client for {} (model={})", llm.getBaseUrl(), llm.getModel());
        return OpenAIOkHttpClient.builder()
                .apiKey(llm.getApiKey())
                .baseUrl(OpenAiSdkUrlNormalizer.normalize(llm.getBaseUrl()))
                .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()))
                .build();
    }

    public boolean isAvailable() {
        return client != null;
    }

    /**
     * Streams a response as content fragments in arrival order.
     *
     * @param systemPrompt task instructions
     * @param userPrompt rendered user prompt
     * @return content fragments; errors as {@link StreamInterruptedException}
     */
    public Flux<String> streamResponse(String systemPrompt, String userPrompt) {
        return Flux.<String>create(sink -> {
                    ChatCompletionCreateParams params = buildChatParams(systemPrompt, userPrompt);
                    log.info("[LLM] Streaming via model={} (prompt chars={})", llm.getModel(), userPrompt.length());
                    try (StreamResponse<ChatCompletionChunk> streamResponse =
                            requireClient().chat().completions().createStreaming(params)) {
                        streamResponse.stream()
                                .forEach(chunk -> chunk.choices().forEach(choice ->
                                        choice.delta().content().ifPresent(sink::next)));
                        sink.complete();
                    } catch (Exception e) {
                        log.error("[LLM] Streaming failed: {}", e.getMessage());
                        sink.error(new StreamInterruptedException("Generation stream failed", e));
                    }
                })
                // blocking SDK stream consumption stays off the servlet thread
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Returns a complete (non-streaming) response.
     *
     * @param systemPrompt task instructions
     * @param userPrompt rendered user prompt
     * @return first choice's content, empty string when the model returned none
     */
    public Mono<String> complete(String systemPrompt, String userPrompt) {
        return Mono.fromCallable(() -> {
                    OpenAIClient available = requireClient();
                    log.info("[LLM] Complete via model={} (prompt chars={})", llm.getModel(), userPrompt.length());
                    ChatCompletion completion =
                            available.chat().completions().create(buildChatParams(systemPrompt, userPrompt));
                    return completion.choices().stream()
                            .findFirst()
                            .flatMap(choice -> choice.message().content())
                            .orElse("");
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private OpenAIClient requireClient() {
        if (client == null) {
            throw new IllegalStateException("LLM client is not configured");
        }
        return client;
    }

    private ChatCompletionCreateParams buildChatParams(String systemPrompt, String userPrompt) {
        return ChatCompletionCreateParams.builder()
                .model(llm.getModel())
                .addSystemMessage(systemPrompt)
                .addUserMessage(userPrompt)
                .temperature(llm.getTemperature())
                .maxCompletionTokens(llm.getMaxTokens())
                .build();
    }

    @PreDestroy
    void close() {
        if (client != null) {
            client.close();
        }
    }
}

package net.imagecraft.application.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIException;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionContentPart;
import com.openai.models.chat.completions.ChatCompletionContentPartImage;
import com.openai.models.chat.completions.ChatCompletionContentPartText;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessageParam;
import com.openai.models.chat.completions.ChatCompletionSystemMessageParam;
import com.openai.models.chat.completions.ChatCompletionUserMessageParam;
import jakarta.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import net.imagecraft.config.ImageCraftProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * {@link PromptEnrichmentService} on the OpenAI Java SDK's chat completions API.
 *
 * <p>The service is disabled when no API key is configured; every call then fails fast with
 * {@link EnrichmentUnavailableException}.</p>
 */
@Service
public class OpenAiPromptEnrichmentService implements PromptEnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(OpenAiPromptEnrichmentService.class);

    /**
     * Placeholder some deployments set instead of leaving the key empty.
     */
    private static final String API_KEY_SENTINEL = "not-configured";

    private final OpenAIClient openAiClient;
    private final boolean available;
    private final String model;
    private final long requestTimeoutSeconds;

    public OpenAiPromptEnrichmentService(
        ImageCraftProperties properties,
        @Value("${IMAGECRAFT_OPENAI_API_KEY:${OPENAI_API_KEY:}}") String apiKey,
        @Value("${IMAGECRAFT_OPENAI_BASE_URL:${OPENAI_BASE_URL:https://api.openai.com/v1}}") String baseUrl,
        @Value("${IMAGECRAFT_OPENAI_REQUEST_TIMEOUT_SECONDS:60}") long requestTimeoutSeconds
    ) {
        this.model = properties.getEnrichment().getModel();
        this.requestTimeoutSeconds = Math.max(1L, requestTimeoutSeconds);
        if (StringUtils.hasText(apiKey) && !API_KEY_SENTINEL.equals(apiKey.trim())) {
            String resolvedBaseUrl = normalizeSdkBaseUrl(baseUrl);
            this.openAiClient = OpenAIOkHttpClient.builder()
                .apiKey(apiKey.trim())
                .baseUrl(resolvedBaseUrl)
                .maxRetries(0)
                .build();
            this.available = true;
            log.info("Prompt enrichment configured (model={}, baseUrl={})", model, resolvedBaseUrl);
        } else {
            this.openAiClient = null;
            this.available = false;
            log.warn("Prompt enrichment is disabled: no API key configured");
        }
    }

    public boolean isAvailable() {
        return available;
    }

    @Override
    public String enrich(EnrichmentKind kind, String text, @Nullable byte[] image) {
        if (!available || openAiClient == null) {
            throw new EnrichmentUnavailableException("Prompt enrichment is not configured");
        }
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
            .model(model)
            .maxCompletionTokens(kind.maxTokens())
            .temperature(kind.temperature())
            .messages(List.of(
                ChatCompletionMessageParam.ofSystem(
                    ChatCompletionSystemMessageParam.builder().content(kind.systemPrompt()).build()
                ),
                ChatCompletionMessageParam.ofUser(userMessage(text, image))
            ))
            .build();
        RequestOptions options = RequestOptions.builder()
            .timeout(Timeout.builder()
                .request(Duration.ofSeconds(requestTimeoutSeconds))
                .build())
            .build();
        try {
            ChatCompletion completion = openAiClient.chat().completions().create(params, options);
            String reply = completion.choices().isEmpty()
                ? ""
                : completion.choices().get(0).message().content().orElse("");
            if (!StringUtils.hasText(reply)) {
                throw new EnrichmentUnavailableException(kind + " returned an empty reply");
            }
            return reply.trim();
        } catch (OpenAIException ex) {
            throw new EnrichmentUnavailableException(kind + " request failed: " + ex.getMessage(), ex);
        }
    }

    private static ChatCompletionUserMessageParam userMessage(String text, @Nullable byte[] image) {
        if (image == null) {
            return ChatCompletionUserMessageParam.builder().content(text).build();
        }
        List<ChatCompletionContentPart> parts = new ArrayList<>();
        parts.add(ChatCompletionContentPart.ofText(ChatCompletionContentPartText.builder().text(text).build()));
        String dataUrl = "data:image/png;base64," + Base64.getEncoder().encodeToString(image);
        parts.add(ChatCompletionContentPart.ofImageUrl(ChatCompletionContentPartImage.builder()
            .imageUrl(ChatCompletionContentPartImage.ImageUrl.builder().url(dataUrl).build())
            .build()));
        return ChatCompletionUserMessageParam.builder().contentOfArrayOfContentParts(parts).build();
    }

    /**
     * Strips trailing slashes and ensures a {@code /v1} suffix.
     */
    static String normalizeSdkBaseUrl(String value) {
        if (!StringUtils.hasText(value)) {
            return "https://api.openai.com/v1";
        }
        String normalized = value.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (!normalized.endsWith("/v1")) {
            normalized = normalized + "/v1";
        }
        return normalized;
    }
}

package net.imagecraft.support.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.Nullable;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import net.imagecraft.exception.ModelAdapterException;
import net.imagecraft.model.image.PixelDimensions;
import net.imagecraft.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

/**
 * {@link ModelAdapter} for one model alias behind an OpenAI-compatible image gateway.
 *
 * <p>Generation posts JSON to {@code /v1/images/generations}; edits post multipart form data to
 * {@code /v1/images/edits}. Responses may carry either inline {@code b64_json} data or a
 * {@code url} that is fetched in a second request.</p>
 */
public class GatewayImageAdapter implements ModelAdapter {

    private static final Logger log = LoggerFactory.getLogger(GatewayImageAdapter.class);

    static final String GENERATIONS_PATH = "/v1/images/generations";
    static final String EDITS_PATH = "/v1/images/edits";

    private final String model;
    private final WebClient webClient;
    private final Duration requestTimeout;

    public GatewayImageAdapter(String model, WebClient webClient, Duration requestTimeout) {
        if (!StringUtils.hasText(model)) {
            throw new IllegalArgumentException("Model alias is required");
        }
        this.model = model;
        this.webClient = webClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String id() {
        return model;
    }

    @Override
    public byte[] synthesize(String prompt, PixelDimensions size) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", prompt);
        body.put("n", 1);
        body.put("size", size.label());
        try {
            JsonNode response = webClient.post()
                .uri(GENERATIONS_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(requestTimeout);
            return extractImage(response);
        } catch (WebClientException | IllegalStateException ex) {
            // IllegalStateException: timeout from block()
            LoggingUtils.warn(log, ex, "Generation request to {} failed", model);
            throw new ModelAdapterException(model, "generation failed: " + LoggingUtils.summarize(ex), ex);
        }
    }

    @Override
    public byte[] edit(byte[] source, @Nullable byte[] mask, String prompt, PixelDimensions size) {
        MultipartBodyBuilder form = new MultipartBodyBuilder();
        form.part("model", model);
        form.part("prompt", prompt);
        form.part("n", "1");
        form.part("size", size.label());
        form.part("image", pngResource(source, "image.png")).contentType(MediaType.IMAGE_PNG);
        if (mask != null) {
            form.part("mask", pngResource(mask, "mask.png")).contentType(MediaType.IMAGE_PNG);
        }
        try {
            JsonNode response = webClient.post()
                .uri(EDITS_PATH)
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(form.build()))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(requestTimeout);
            return extractImage(response);
        } catch (WebClientException | IllegalStateException ex) {
            LoggingUtils.warn(log, ex, "Edit request to {} failed (mask: {})", model, mask != null);
            throw new ModelAdapterException(model, "edit failed: " + LoggingUtils.summarize(ex), ex);
        }
    }

    private byte[] extractImage(@Nullable JsonNode response) {
        JsonNode first = response == null ? null : response.path("data").path(0);
        if (first == null || first.isMissingNode()) {
            throw new ModelAdapterException(model, "response contained no image data");
        }
        String b64 = first.path("b64_json").asText(null);
        if (StringUtils.hasText(b64)) {
            try {
                return Base64.getDecoder().decode(b64);
            } catch (IllegalArgumentException ex) {
                throw new ModelAdapterException(model, "response carried invalid base64 image data", ex);
            }
        }
        String url = first.path("url").asText(null);
        if (StringUtils.hasText(url)) {
            return download(url);
        }
        throw new ModelAdapterException(model, "response image had neither b64_json nor url");
    }

    private byte[] download(String url) {
        byte[] bytes = webClient.get()
            .uri(url)
            .header(HttpHeaders.ACCEPT, MediaType.ALL_VALUE)
            .retrieve()
            .bodyToMono(byte[].class)
            .block(requestTimeout);
        if (bytes == null || bytes.length == 0) {
            throw new ModelAdapterException(model, "image download returned no bytes: " + url);
        }
        log.debug("Downloaded {} bytes for {} from {}", bytes.length, model, url);
        return bytes;
    }

    private static ByteArrayResource pngResource(byte[] bytes, String filename) {
        return new ByteArrayResource(bytes) {
            @Override
            public String getFilename() {
                return filename;
            }
        };
    }
}

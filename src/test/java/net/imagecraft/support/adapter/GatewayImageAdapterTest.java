package net.imagecraft.support.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import net.imagecraft.exception.ModelAdapterException;
import net.imagecraft.model.image.PixelDimensions;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

class GatewayImageAdapterTest {

    private static final PixelDimensions SQUARE = new PixelDimensions(1024, 1024);
    private static final byte[] IMAGE = {(byte) 0x89, 'P', 'N', 'G', 1, 2, 3};

    @Test
    void should_DecodeInlineImage_When_ResponseCarriesBase64() {
        List<ClientRequest> requests = new ArrayList<>();
        GatewayImageAdapter adapter = adapter(request -> {
            requests.add(request);
            return Mono.just(json("{\"data\":[{\"b64_json\":\"" + Base64.getEncoder().encodeToString(IMAGE) + "\"}]}"));
        }, Duration.ofSeconds(5));

        byte[] result = adapter.synthesize("a lighthouse", SQUARE);

        assertThat(result).isEqualTo(IMAGE);
        assertThat(requests).singleElement().satisfies(request -> {
            assertThat(request.method()).isEqualTo(HttpMethod.POST);
            assertThat(request.url().getPath()).isEqualTo(GatewayImageAdapter.GENERATIONS_PATH);
        });
    }

    @Test
    void should_DownloadImage_When_ResponseCarriesUrl() {
        GatewayImageAdapter adapter = adapter(request -> {
            if (HttpMethod.GET.equals(request.method())) {
                return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.IMAGE_PNG_VALUE)
                    .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(IMAGE)))
                    .build());
            }
            return Mono.just(json("{\"data\":[{\"url\":\"https://cdn.example.com/out.png\"}]}"));
        }, Duration.ofSeconds(5));

        assertThat(adapter.edit(IMAGE, null, "make it blue", SQUARE)).isEqualTo(IMAGE);
    }

    @Test
    void should_ThrowAdapterException_When_GatewayReturnsError() {
        GatewayImageAdapter adapter = adapter(request -> Mono.just(ClientResponse.create(HttpStatus.TOO_MANY_REQUESTS)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body("{\"error\":\"quota\"}")
            .build()), Duration.ofSeconds(5));

        assertThatThrownBy(() -> adapter.synthesize("x", SQUARE))
            .isInstanceOf(ModelAdapterException.class)
            .satisfies(ex -> assertThat(((ModelAdapterException) ex).getAdapterId()).isEqualTo("gpt-image"));
    }

    @Test
    void should_ThrowAdapterException_When_RequestTimesOut() {
        GatewayImageAdapter adapter = adapter(request -> Mono.never(), Duration.ofMillis(20));

        assertThatThrownBy(() -> adapter.synthesize("x", SQUARE)).isInstanceOf(ModelAdapterException.class);
    }

    @Test
    void should_ThrowAdapterException_When_ResponseHasNoData() {
        GatewayImageAdapter adapter = adapter(request -> Mono.just(json("{\"data\":[]}")), Duration.ofSeconds(5));

        assertThatThrownBy(() -> adapter.edit(IMAGE, IMAGE, "x", SQUARE))
            .isInstanceOf(ModelAdapterException.class)
            .hasMessageContaining("no image data");
    }

    private static GatewayImageAdapter adapter(ExchangeFunction exchange, Duration timeout) {
        WebClient webClient = WebClient.builder()
            .baseUrl("http://gateway.test")
            .exchangeFunction(exchange)
            .build();
        return new GatewayImageAdapter("gpt-image", webClient, timeout);
    }

    private static ClientResponse json(String body) {
        return ClientResponse.create(HttpStatus.OK)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }
}

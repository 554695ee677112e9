package net.imagecraft.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Configures the shared WebClient builder used by the image gateway adapters.
 *
 * <p>Image generation is slow, so read and response timeouts follow the gateway request
 * timeout rather than a short default. Codec buffers are sized for base64 image payloads.</p>
 */
@Configuration
public class WebClientConfig {

    private static final String USER_AGENT = "imagecraft/0.1";
    private static final int MAX_IN_MEMORY_BYTES = 32 * 1024 * 1024;

    @Bean
    public WebClient.Builder webClientBuilder(ImageCraftProperties properties) {
        long timeoutSeconds = Math.max(1, properties.getGateway().getRequestTimeout().toSeconds());
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(30, TimeUnit.SECONDS))
            )
            .responseTimeout(properties.getGateway().getRequestTimeout());

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(MAX_IN_MEMORY_BYTES))
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, USER_AGENT)
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}

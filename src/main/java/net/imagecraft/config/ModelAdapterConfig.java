package net.imagecraft.config;

import java.util.List;
import net.imagecraft.support.adapter.GatewayImageAdapter;
import net.imagecraft.support.adapter.ModelAdapter;
import net.imagecraft.support.adapter.ModelAdapterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Wires one gateway adapter per configured image model alias, in fallback order.
 */
@Configuration
public class ModelAdapterConfig {

    private static final Logger log = LoggerFactory.getLogger(ModelAdapterConfig.class);

    @Bean
    public ModelAdapterRegistry modelAdapterRegistry(ImageCraftProperties properties, WebClient.Builder webClientBuilder) {
        ImageCraftProperties.Gateway gateway = properties.getGateway();
        WebClient.Builder gatewayClient = webClientBuilder.clone().baseUrl(gateway.getBaseUrl());
        if (StringUtils.hasText(gateway.getApiKey())) {
            gatewayClient.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + gateway.getApiKey());
        } else {
            log.warn("No image gateway API key configured; requests to {} are sent unauthenticated", gateway.getBaseUrl());
        }
        WebClient webClient = gatewayClient.build();

        List<ModelAdapter> adapters = properties.getModels().getImageModels().stream()
            .map(alias -> (ModelAdapter) new GatewayImageAdapter(alias, webClient, gateway.getRequestTimeout()))
            .toList();
        log.info("Registered image models in fallback order: {}", properties.getModels().getImageModels());
        return new ModelAdapterRegistry(adapters);
    }
}

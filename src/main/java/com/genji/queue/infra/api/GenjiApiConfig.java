package com.genji.queue.infra.api;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

@Configuration
public class GenjiApiConfig {

    public static final String API_KEY_HEADER = "X-API-KEY";

    @Bean
    public RestTemplate genjiApiRestTemplate(RestTemplateBuilder builder, GenjiApiProperties props) {
        RestTemplateBuilder configured = builder
                .rootUri(props.getBaseUrl())
                .connectTimeout(props.getConnectTimeout())
                .readTimeout(props.getReadTimeout());
        if (StringUtils.hasText(props.getApiKey())) {
            configured = configured.defaultHeader(API_KEY_HEADER, props.getApiKey());
        }
        return configured.build();
    }
}

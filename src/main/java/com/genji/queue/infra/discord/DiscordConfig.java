package com.genji.queue.infra.discord;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

@Configuration
public class DiscordConfig {

    @Bean
    public RestTemplate discordRestTemplate(RestTemplateBuilder builder, DiscordProperties props) {
        RestTemplateBuilder configured = builder
                .rootUri(props.getBaseUrl())
                .connectTimeout(props.getConnectTimeout())
                .readTimeout(props.getReadTimeout());
        if (StringUtils.hasText(props.getBotToken())) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bot " + props.getBotToken());
        }
        return configured.build();
    }
}

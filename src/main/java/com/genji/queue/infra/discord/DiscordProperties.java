package com.genji.queue.infra.discord;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "genji.discord")
public class DiscordProperties {

    private String baseUrl = "https://discord.com/api/v10";

    private String botToken;

    /**
     * Discord 메시지 본문 상한
     */
    private int maxContentLength = 2000;

    private Duration connectTimeout = Duration.ofSeconds(3);
    private Duration readTimeout = Duration.ofSeconds(10);
}

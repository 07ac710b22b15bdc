package com.genji.queue.infra.discord;

import com.genji.queue.usecase.alert.port.ChatAlertSender;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.util.Map;

/**
 * Discord 채널에 봇 메시지를 보낸다. 본문은 Discord 상한에 맞춰 잘린다.
 */
@Slf4j
@Component
public class DiscordAlertSender implements ChatAlertSender {

    static final String MESSAGES_PATH = "/channels/{channelId}/messages";
    private static final String ELLIPSIS = "...";

    private final RestTemplate restTemplate;
    private final DiscordProperties props;

    public DiscordAlertSender(@Qualifier("discordRestTemplate") RestTemplate restTemplate,
                              DiscordProperties props) {
        this.restTemplate = restTemplate;
        this.props = props;
    }

    @Override
    public void send(String channelId, String content) {
        if (!StringUtils.hasText(channelId)) {
            throw new IllegalStateException("alert channel id is not configured");
        }
        restTemplate.postForEntity(MESSAGES_PATH, Map.of("content", truncate(content)), Void.class, channelId);
        log.debug("[Discord] alert sent. channelId={}, length={}", channelId, content.length());
    }

    String truncate(String content) {
        int max = props.getMaxContentLength();
        if (content.length() <= max) {
            return content;
        }
        return content.substring(0, max - ELLIPSIS.length()) + ELLIPSIS;
    }
}

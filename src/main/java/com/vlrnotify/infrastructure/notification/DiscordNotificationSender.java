package com.vlrnotify.infrastructure.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vlrnotify.domain.model.DeliveryResult;
import com.vlrnotify.domain.model.Notification;
import com.vlrnotify.domain.ports.NotificationSender;
import com.vlrnotify.infrastructure.scraper.HttpClientUtil;
import com.vlrnotify.infrastructure.scraper.HttpClientUtil.HttpStatusException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Posts notifications to Discord channels through the bot REST API.
 *
 * One attempt per notification; a failed post is reported, not retried.
 */
@Component
@ConditionalOnProperty(name = "vlr.discord.enabled", havingValue = "true")
public class DiscordNotificationSender implements NotificationSender {

    private static final Logger logger = LoggerFactory.getLogger(DiscordNotificationSender.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final String API_BASE = "https://discord.com/api/v10";

    private final String apiBase;
    private final Map<String, String> headers;
    private final Duration timeout;
    private final NotificationMessageFormatter formatter;

    @Autowired
    public DiscordNotificationSender(
            @Value("${vlr.discord.token}") String token,
            @Value("${vlr.discord.api-base:" + API_BASE + "}") String apiBase,
            @Value("${vlr.discord.timeout-ms:10000}") long timeoutMs) {
        this(token, apiBase, Duration.ofMillis(timeoutMs), new NotificationMessageFormatter());
    }

    DiscordNotificationSender(String token, String apiBase, Duration timeout, NotificationMessageFormatter formatter) {
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("vlr.discord.token must be set when Discord delivery is enabled");
        }
        this.apiBase = apiBase.endsWith("/") ? apiBase.substring(0, apiBase.length() - 1) : apiBase;
        this.headers = Map.of(
            "Authorization", "Bot " + token.trim(),
            "User-Agent", "DiscordBot (https://github.com/vlr-match-notifier, 1.0)"
        );
        this.timeout = timeout;
        this.formatter = formatter;
    }

    @Override
    public DeliveryResult send(long channelId, Notification notification) {
        String url = apiBase + "/channels/" + channelId + "/messages";
        try {
            post(url, formatter.format(notification, Instant.now()));
            return DeliveryResult.ok();
        } catch (HttpStatusException e) {
            String reason = formatError(e.getStatus(), e.getBody());
            logger.warn("Discord rejected message to channel {}: {}", channelId, reason);
            return DeliveryResult.failed(reason);
        } catch (IOException e) {
            logger.warn("Discord request to channel {} failed: {}", channelId, e.getMessage());
            return DeliveryResult.failed(e.getMessage());
        }
    }

    /**
     * Hook for tests to replace the network call.
     */
    protected JsonNode post(String url, JsonNode body) throws IOException {
        return HttpClientUtil.postJson(url, body, headers, timeout);
    }

    /**
     * Builds a readable reason from a Discord error payload ("message", optional "retry_after").
     */
    static String formatError(int status, String body) {
        String message = null;
        Double retryAfter = null;
        if (body != null && !body.isBlank()) {
            try {
                JsonNode json = objectMapper.readTree(body);
                if (json.hasNonNull("message")) {
                    message = json.get("message").asText();
                }
                if (json.hasNonNull("retry_after")) {
                    retryAfter = json.get("retry_after").asDouble();
                }
            } catch (IOException e) {
                message = body.length() > 200 ? body.substring(0, 200) + "..." : body;
            }
        }
        StringBuilder sb = new StringBuilder("Discord API ").append(status);
        if (message != null) {
            sb.append(": ").append(message);
        }
        if (status == 429 && retryAfter != null) {
            sb.append(" (retry after ").append(retryAfter).append("s)");
        }
        return sb.toString();
    }
}

package com.vlrnotify.infrastructure.rest;

import com.vlrnotify.application.usecase.GuildSettingsUseCase;
import com.vlrnotify.domain.model.GuildSettings;
import com.vlrnotify.domain.model.SubscriptionKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.function.Supplier;

/**
 * REST controller for the guild admin commands.
 */
@RestController
@RequestMapping("/guilds/{guildId}")
public class GuildSettingsController {

    private static final Logger logger = LoggerFactory.getLogger(GuildSettingsController.class);

    private final GuildSettingsUseCase guildSettingsUseCase;

    public GuildSettingsController(GuildSettingsUseCase guildSettingsUseCase) {
        this.guildSettingsUseCase = guildSettingsUseCase;
    }

    public record ChannelRequest(Long channelId) {}

    public record LeadTimeRequest(Integer minutes) {}

    public record SubscriptionRequest(SubscriptionKind kind, String value) {}

    @GetMapping
    public ResponseEntity<?> get(@PathVariable long guildId) {
        return handle("reading settings of guild " + guildId, () -> guildSettingsUseCase.get(guildId));
    }

    @PutMapping("/channel")
    public ResponseEntity<?> setChannel(@PathVariable long guildId, @RequestBody ChannelRequest request) {
        return handle("setting channel of guild " + guildId, () -> {
            if (request.channelId() == null) {
                throw new IllegalArgumentException("channelId is required");
            }
            return guildSettingsUseCase.setChannel(guildId, request.channelId());
        });
    }

    @DeleteMapping("/channel")
    public ResponseEntity<?> clearChannel(@PathVariable long guildId) {
        return handle("clearing channel of guild " + guildId, () -> guildSettingsUseCase.clearChannel(guildId));
    }

    @PutMapping("/lead-time")
    public ResponseEntity<?> setLeadTime(@PathVariable long guildId, @RequestBody LeadTimeRequest request) {
        return handle("setting lead time of guild " + guildId, () -> {
            if (request.minutes() == null) {
                throw new IllegalArgumentException("minutes is required");
            }
            return guildSettingsUseCase.setLeadTime(guildId, request.minutes());
        });
    }

    @PostMapping("/subscriptions")
    public ResponseEntity<?> subscribe(@PathVariable long guildId, @RequestBody SubscriptionRequest request) {
        return handle("subscribing guild " + guildId, () -> Map.of(
            "added", guildSettingsUseCase.subscribe(guildId, request.kind(), request.value()),
            "subscriptions", guildSettingsUseCase.get(guildId).getSubscriptions()));
    }

    @DeleteMapping("/subscriptions")
    public ResponseEntity<?> unsubscribe(@PathVariable long guildId, @RequestBody SubscriptionRequest request) {
        return handle("unsubscribing guild " + guildId, () -> Map.of(
            "removed", guildSettingsUseCase.unsubscribe(guildId, request.kind(), request.value()),
            "subscriptions", guildSettingsUseCase.get(guildId).getSubscriptions()));
    }

    @PostMapping("/subscriptions/toggle")
    public ResponseEntity<?> toggle(@PathVariable long guildId, @RequestBody SubscriptionRequest request) {
        return handle("toggling subscription of guild " + guildId, () -> {
            GuildSettingsUseCase.ToggleResult result =
                guildSettingsUseCase.toggle(guildId, request.kind(), request.value());
            GuildSettings settings = guildSettingsUseCase.get(guildId);
            return Map.of("result", result, "subscriptions", settings.getSubscriptions());
        });
    }

    private ResponseEntity<?> handle(String action, Supplier<Object> command) {
        try {
            return ResponseEntity.ok(command.get());
        } catch (IllegalArgumentException e) {
            logger.info("Rejected {}: {}", action, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            logger.error("Error {}", action, e);
            return ResponseEntity.internalServerError().build();
        }
    }
}

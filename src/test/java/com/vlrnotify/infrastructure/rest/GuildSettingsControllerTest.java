package com.vlrnotify.infrastructure.rest;

import com.vlrnotify.application.usecase.GuildSettingsUseCase;
import com.vlrnotify.domain.model.GuildSettings;
import com.vlrnotify.domain.model.SubscriptionKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

class GuildSettingsControllerTest {

    private GuildSettingsUseCase useCase;
    private GuildSettingsController controller;

    @BeforeEach
    void setUp() {
        useCase = mock(GuildSettingsUseCase.class);
        controller = new GuildSettingsController(useCase);
    }

    @Test
    void testInvalidLeadTimeIsBadRequest() {
        when(useCase.setLeadTime(anyLong(), anyInt())).thenThrow(new IllegalArgumentException("out of range"));

        ResponseEntity<?> response = controller.setLeadTime(1L, new GuildSettingsController.LeadTimeRequest(5000));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals(Map.of("error", "out of range"), response.getBody());
    }

    @Test
    void testMissingChannelIsBadRequest() {
        ResponseEntity<?> response = controller.setChannel(1L, new GuildSettingsController.ChannelRequest(null));

        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        verifyNoInteractions(useCase);
    }

    @Test
    void testStoreFailureIsServerError() {
        when(useCase.get(1L)).thenThrow(new IllegalStateException("disk full"));

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, controller.get(1L).getStatusCode());
    }

    @Test
    void testToggleReturnsResultAndSubscriptions() {
        when(useCase.toggle(1L, SubscriptionKind.TEAM, "NRG")).thenReturn(GuildSettingsUseCase.ToggleResult.SUBSCRIBED);
        when(useCase.get(1L)).thenReturn(new GuildSettings(1L));

        ResponseEntity<?> response = controller.toggle(1L,
            new GuildSettingsController.SubscriptionRequest(SubscriptionKind.TEAM, "NRG"));

        assertEquals(HttpStatus.OK, response.getStatusCode());
        Map<?, ?> body = (Map<?, ?>) response.getBody();
        assertEquals(GuildSettingsUseCase.ToggleResult.SUBSCRIBED, body.get("result"));
    }
}

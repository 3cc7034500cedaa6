package com.cleanwater.backend.modules.audit.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;

import com.cleanwater.backend.global.web.RequestMetadata;
import com.cleanwater.backend.global.web.RequestMetadataAccessor;
import com.cleanwater.backend.modules.audit.domain.AuditOutcome;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class AuditRecorderTest {

    private static final Instant NOW = Instant.parse("2025-03-01T08:00:00Z");

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private RequestMetadataAccessor requestMetadataAccessor;

    private AuditRecorder auditRecorder;

    @BeforeEach
    void setUp() {
        auditRecorder = new AuditRecorder(eventPublisher, requestMetadataAccessor, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void publishesEventEnrichedWithRequestMetadata() {
        when(requestMetadataAccessor.current())
                .thenReturn(Optional.of(new RequestMetadata("req-1", "10.0.0.8", "curl/8.0")));

        auditRecorder.success(AuditAction.USER_LOGIN, "user", 42L, AuditActor.of(42L, "alice"), Map.of("twoFactor", false));

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        AuditEvent event = captor.getValue();
        assertThat(event.action()).isEqualTo("user_login");
        assertThat(event.resourceId()).isEqualTo("42");
        assertThat(event.actorUserId()).isEqualTo(42L);
        assertThat(event.outcome()).isEqualTo(AuditOutcome.SUCCESS);
        assertThat(event.detail()).containsEntry("twoFactor", false);
        assertThat(event.ipAddress()).isEqualTo("10.0.0.8");
        assertThat(event.requestId()).isEqualTo("req-1");
        assertThat(event.occurredAt().toInstant()).isEqualTo(NOW);
    }

    @Test
    void systemEventsOutsideRequestsCarryNoActorOrMetadata() {
        when(requestMetadataAccessor.current()).thenReturn(Optional.empty());

        auditRecorder.failure(AuditAction.USER_LOGIN, "user", null, null, Map.of());

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        AuditEvent event = captor.getValue();
        assertThat(event.actorUserId()).isNull();
        assertThat(event.actorUsername()).isNull();
        assertThat(event.resourceId()).isNull();
        assertThat(event.detail()).isNull();
        assertThat(event.ipAddress()).isNull();
        assertThat(event.outcome()).isEqualTo(AuditOutcome.FAILURE);
    }

    @Test
    void publishFailureNeverReachesCaller() {
        when(requestMetadataAccessor.current()).thenReturn(Optional.empty());
        doThrow(new IllegalStateException("listener blew up")).when(eventPublisher).publishEvent(any(Object.class));

        assertThatCode(() -> auditRecorder.success(AuditAction.API_KEY_CREATE, "api_key", 1L, AuditActor.system(), Map.of()))
                .doesNotThrowAnyException();
    }
}

package com.revolution.backend.service;

import com.revolution.backend.dto.SecurityEventDTO;
import com.revolution.backend.model.SecurityEvent;
import com.revolution.backend.model.SecurityEventType;
import com.revolution.backend.repository.SecurityEventRepository;
import com.revolution.backend.security.SecurityMarkers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Per-account security history. Request context (client address, user agent, correlation id) is read
 * from the MDC populated by {@code RequestCorrelationFilter}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SecurityEventService {

    private static final int USER_AGENT_MAX = 512;

    private final SecurityEventRepository securityEventRepository;
    private final Clock clock;

    @Transactional
    public void record(Long userId, SecurityEventType type) {
        log.info(SecurityMarkers.SECURITY, "security_event type={} userId={}", type.code(), userId);
        try {
            SecurityEvent event = SecurityEvent.builder()
                    .userId(userId)
                    .eventType(type.code())
                    .ipAddress(MDC.get("clientIp"))
                    .userAgent(truncate(MDC.get("userAgent")))
                    .correlationId(MDC.get("correlationId"))
                    .createdAt(clock.instant())
                    .build();
            securityEventRepository.save(event);
        } catch (DataAccessException e) {
            log.warn("Failed to record security event {} for user {} - {}", type.code(), userId, e.getMessage());
        }
    }

    @Transactional(readOnly = true)
    public List<SecurityEventDTO> recentEvents(Long userId) {
        return securityEventRepository.findTop50ByUserIdOrderByCreatedAtDescIdDesc(userId).stream()
                .map(event -> SecurityEventDTO.builder()
                        .id(event.getId())
                        .type(event.getEventType())
                        .ipAddress(event.getIpAddress())
                        .userAgent(event.getUserAgent())
                        .createdAt(event.getCreatedAt())
                        .build())
                .toList();
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= USER_AGENT_MAX) {
            return value;
        }
        return value.substring(0, USER_AGENT_MAX);
    }
}

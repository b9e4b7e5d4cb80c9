package com.example.courier.realtime.controller;

import com.example.courier.realtime.dto.AnnouncementRequest;
import com.example.courier.shared.aspect.Monitored;
import com.example.courier.shared.event.DomainEventPublisher;
import com.example.courier.shared.event.SystemAnnouncement;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/realtime/announcements")
@RequiredArgsConstructor
@Slf4j
public class AnnouncementController {

    private final DomainEventPublisher domainEventPublisher;

    @PostMapping
    @Monitored("controller")
    @RateLimiter(name = "announcementLimiter")
    public ResponseEntity<Map<String, String>> announce(@Valid @RequestBody AnnouncementRequest request) {
        log.info("Publishing system announcement to {} (correlationId={})",
                request.getTargetRoles() == null || request.getTargetRoles().isEmpty() ? "all roles" : request.getTargetRoles(),
                request.getCorrelationId());
        domainEventPublisher.publish(new SystemAnnouncement(request.getMessage(), request.getTargetRoles()));
        return ResponseEntity.accepted().body(Map.of("status", "accepted"));
    }
}

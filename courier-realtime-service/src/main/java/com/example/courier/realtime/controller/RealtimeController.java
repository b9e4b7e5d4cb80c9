package com.example.courier.realtime.controller;

import com.example.courier.realtime.dto.ConnectionStats;
import com.example.courier.realtime.session.ConnectionManager;
import com.example.courier.shared.aspect.Monitored;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/realtime")
@RequiredArgsConstructor
@Slf4j
@Monitored("controller")
public class RealtimeController {

    private final ConnectionManager connectionManager;

    @GetMapping("/stats")
    public ResponseEntity<ConnectionStats> getStats() {
        return ResponseEntity.ok(connectionManager.stats());
    }

    @GetMapping("/connected/{userId}")
    public ResponseEntity<Boolean> isUserConnected(@PathVariable long userId) {
        boolean connected = connectionManager.isUserConnected(userId);
        log.debug("User {} connected: {}", userId, connected);
        return ResponseEntity.ok(connected);
    }
}

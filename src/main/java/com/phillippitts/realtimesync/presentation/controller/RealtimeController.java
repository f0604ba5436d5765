package com.phillippitts.realtimesync.presentation.controller;

import com.phillippitts.realtimesync.domain.ConnectionStateSnapshot;
import com.phillippitts.realtimesync.domain.HealthStatus;
import com.phillippitts.realtimesync.service.RealtimeSubscriptionManager;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Operator endpoints for inspecting and nudging the realtime channel.
 */
@RestController
@RequestMapping("/api/v1/realtime")
class RealtimeController {

    private static final Logger LOG = LogManager.getLogger(RealtimeController.class);

    private final RealtimeSubscriptionManager manager;

    RealtimeController(RealtimeSubscriptionManager manager) {
        this.manager = manager;
    }

    @GetMapping("/health")
    ResponseEntity<HealthStatus> health() {
        return ResponseEntity.ok(manager.getHealthStatus());
    }

    @GetMapping("/state")
    ResponseEntity<ConnectionStateSnapshot> state() {
        return ResponseEntity.ok(manager.getConnectionState());
    }

    @PostMapping("/reconnect")
    ResponseEntity<ConnectionStateSnapshot> reconnect() {
        LOG.info("Reconnect requested over HTTP");
        manager.forceReconnect();
        return ResponseEntity.accepted().body(manager.getConnectionState());
    }

    @PostMapping("/sync")
    ResponseEntity<Map<String, Object>> sync() {
        int cued = manager.forceSync();
        return ResponseEntity.ok(Map.of(
                "cued", cued,
                "timestamp", Instant.now().toString()
        ));
    }
}

/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.alertpull.web.controller;

import com.alertpull.common.model.StreamRequest;
import com.alertpull.messaging.core.Subscription;
import com.alertpull.server.engine.RunResult;
import com.alertpull.server.service.StreamService;
import org.springframework.context.annotation.Lazy;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API for bounded pulls and subscription provisioning.
 */
@RestController
@RequestMapping("/api/v1")
public class StreamController {

    private final StreamService streamService;

    public StreamController(@Lazy StreamService streamService) {
        this.streamService = streamService;
    }

    /**
     * POST /api/v1/streams/{subscription}/pull - Pull until a stopping condition holds.
     * The body is optional; its subscription_name is replaced by the path variable.
     */
    @PostMapping("/streams/{subscription}/pull")
    public ResponseEntity<RunResult> pull(@PathVariable("subscription") String subscription,
                                          @RequestBody(required = false) StreamRequest request) {
        StreamRequest req = request != null ? request : new StreamRequest();
        req.setSubscriptionName(subscription);
        return ResponseEntity.ok(streamService.fetch(req));
    }

    /** PUT /api/v1/subscriptions/{name} - Get or create; optional ?topic=. */
    @PutMapping("/subscriptions/{name}")
    public ResponseEntity<Map<String, Object>> ensureSubscription(@PathVariable("name") String name,
                                                                  @RequestParam(value = "topic", required = false) String topic) {
        Subscription sub = streamService.ensureSubscription(name, topic);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", sub.name());
        body.put("path", sub.path());
        body.put("topic", sub.topic());
        return ResponseEntity.ok(body);
    }

    /** DELETE /api/v1/subscriptions/{name} - Idempotent. */
    @DeleteMapping("/subscriptions/{name}")
    public ResponseEntity<Void> deleteSubscription(@PathVariable("name") String name) {
        streamService.deleteSubscription(name);
        return ResponseEntity.noContent().build();
    }

    /** GET /api/v1/health - Health check endpoint. */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "active_runs", streamService.activeRuns()));
    }
}

package com.dashboard.api;

import com.dashboard.domain.model.EventIngestRequest;
import com.dashboard.domain.model.IngestResponse;
import com.dashboard.domain.model.OrderIngestRequest;
import com.dashboard.domain.service.IngestionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ingestion endpoints.
 * 
 * - POST /api/v1/events - Track an event (creates the user if missing)
 * - POST /api/v1/orders - Record a completed order
 * 
 * Both answer 201 with {id, created_at}.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class IngestionController {

    private final IngestionService ingestionService;

    @PostMapping("/events")
    public ResponseEntity<IngestResponse> createEvent(@Valid @RequestBody EventIngestRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ingestionService.ingestEvent(request));
    }

    @PostMapping("/orders")
    public ResponseEntity<IngestResponse> createOrder(@Valid @RequestBody OrderIngestRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ingestionService.ingestOrder(request));
    }
}

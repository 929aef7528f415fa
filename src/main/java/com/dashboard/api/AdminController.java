package com.dashboard.api;

import com.dashboard.domain.model.RefreshResult;
import com.dashboard.domain.service.RefreshCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operational endpoints.
 * 
 * POST /api/v1/admin/refresh-views runs one refresh cycle synchronously,
 * through the same code path as the periodic timer.
 * 
 * Response status:
 * - 200 SUCCESS or SKIPPED (a cycle was already running)
 * - 500 FAILED, body carries the failure message
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
public class AdminController {

    private final RefreshCoordinator refreshCoordinator;

    @PostMapping("/refresh-views")
    public ResponseEntity<RefreshResult> refreshViews() {
        log.info("Manual view refresh requested");
        RefreshResult result = refreshCoordinator.refreshNow();
        HttpStatus status = result.getOutcome() == RefreshResult.Outcome.FAILED
                ? HttpStatus.INTERNAL_SERVER_ERROR
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }
}

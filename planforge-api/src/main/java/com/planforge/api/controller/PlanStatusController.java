package com.planforge.api.controller;

import com.planforge.api.dto.response.PlanStatusResponse;
import com.planforge.core.status.PlanStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/plans")
@RequiredArgsConstructor
public class PlanStatusController {

    private final PlanStatusService planStatusService;

    @GetMapping("/{planId}/status")
    public ResponseEntity<PlanStatusResponse> getStatus(
            @PathVariable UUID planId,
            Authentication authentication
    ) {
        UUID userId = UUID.fromString(authentication.getName());
        return ResponseEntity.ok(PlanStatusResponse.from(planStatusService.getStatus(planId, userId)));
    }
}

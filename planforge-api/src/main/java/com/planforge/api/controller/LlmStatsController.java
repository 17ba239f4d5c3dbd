package com.planforge.api.controller;

import com.planforge.llm.router.ProviderRouter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/llm")
@RequiredArgsConstructor
public class LlmStatsController {

    private final ProviderRouter providerRouter;

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStatistics() {
        return ResponseEntity.ok(providerRouter.getStatistics());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> stats = providerRouter.getStatistics();
        int totalProviders = (Integer) stats.get("totalProviders");
        boolean healthy = totalProviders > 0;

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", healthy ? "UP" : "DOWN");
        body.put("totalProviders", totalProviders);
        body.put("chain", stats.get("chain"));
        return ResponseEntity.status(healthy ? 200 : 503).body(body);
    }
}

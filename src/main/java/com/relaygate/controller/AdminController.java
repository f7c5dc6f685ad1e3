package com.relaygate.controller;

import com.relaygate.config.GatewayProperties;
import com.relaygate.model.CircuitState;
import com.relaygate.model.dto.CostProjection;
import com.relaygate.model.dto.CostSummary;
import com.relaygate.model.dto.ProviderStatus;
import com.relaygate.service.AdminService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;

/**
 * Admin API for the provider catalog, breaker state and spend reporting.
 */
@Slf4j
@RestController
@RequestMapping("/v1/admin")
public class AdminController {

    private final AdminService adminService;

    public AdminController(AdminService adminService) {
        this.adminService = adminService;
    }

    @GetMapping("/providers")
    public ResponseEntity<List<ProviderStatus>> getProviders() {
        return ResponseEntity.ok(adminService.getProviders());
    }

    /**
     * Replace the provider catalog. Body has the shape of {@code gateway.providers}:
     * an object keyed by provider id, in routing order for equal priorities.
     */
    @PostMapping("/providers/reload")
    public ResponseEntity<List<ProviderStatus>> reloadProviders(
            @RequestBody LinkedHashMap<String, GatewayProperties.ProviderConfig> providers) {
        log.info("Admin: reloading provider catalog ({} entries)", providers.size());
        return ResponseEntity.ok(adminService.reloadProviders(providers));
    }

    @GetMapping("/breakers")
    public ResponseEntity<List<CircuitState>> getBreakers() {
        return ResponseEntity.ok(adminService.getBreakers());
    }

    /**
     * @param period hour, day, week or month
     */
    @GetMapping("/usage/summary")
    public ResponseEntity<CostSummary> getUsageSummary(@RequestParam(defaultValue = "day") String period) {
        return ResponseEntity.ok(adminService.getUsageSummary(period));
    }

    @GetMapping("/usage/projection")
    public ResponseEntity<CostProjection> getProjection() {
        return ResponseEntity.ok(adminService.getProjection());
    }
}

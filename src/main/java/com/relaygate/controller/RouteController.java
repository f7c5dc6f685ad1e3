package com.relaygate.controller;

import com.relaygate.idempotency.IdempotencyService;
import com.relaygate.model.GatewayHeaders;
import com.relaygate.model.GatewayResponse;
import com.relaygate.service.RoutingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Routing endpoint. Every call must carry an {@code Idempotency-Key}; a repeated key
 * with the same body is answered from the idempotency store.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class RouteController {

    private final RoutingService routingService;
    private final IdempotencyService idempotencyService;

    public RouteController(RoutingService routingService, IdempotencyService idempotencyService) {
        this.routingService = routingService;
        this.idempotencyService = idempotencyService;
    }

    /**
     * The body is taken raw: the idempotency record key is computed over the exact
     * bytes the client sent.
     */
    @PostMapping(value = "/route", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<String>> route(
            @RequestHeader(value = GatewayHeaders.IDEMPOTENCY_KEY, required = false) String idempotencyKey,
            @RequestBody(required = false) String body) {

        return idempotencyService.execute(idempotencyKey, body, () -> routingService.route(body))
                .map(this::toResponseEntity);
    }

    private ResponseEntity<String> toResponseEntity(GatewayResponse response) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (response.getHeaders() != null) {
            response.getHeaders().forEach(headers::addAll);
        }

        return ResponseEntity.status(response.getStatus())
                .headers(headers)
                .body(response.getBody());
    }
}

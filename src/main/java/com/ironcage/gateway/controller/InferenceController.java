package com.ironcage.gateway.controller;

import com.ironcage.gateway.filter.LoggingFilter;
import com.ironcage.gateway.orchestration.InferenceRequest;
import com.ironcage.gateway.orchestration.InferenceResult;
import com.ironcage.gateway.orchestration.RequestOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Inference Controller
 *
 * Single entry point for agent inference calls. All admission, routing and cost
 * handling happens in the {@link RequestOrchestrator}; failures are rendered by the
 * global exception handler.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Inference", description = "Budget-enforced LLM calls for agents")
public class InferenceController {

    private final RequestOrchestrator orchestrator;

    public InferenceController(RequestOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping("/inference")
    @Operation(summary = "Run an inference call for the authenticated agent",
            security = @SecurityRequirement(name = "agentToken"))
    public Mono<ResponseEntity<InferenceResult>> infer(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(value = LoggingFilter.CORRELATION_ID_HEADER, required = false) String correlationId,
            @RequestBody InferenceRequest request) {
        return orchestrator.execute(BearerToken.from(authorization), request, correlationId)
                .map(ResponseEntity::ok);
    }
}

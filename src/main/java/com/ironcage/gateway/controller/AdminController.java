package com.ironcage.gateway.controller;

import com.ironcage.gateway.budget.BudgetLedger;
import com.ironcage.gateway.directory.AgentDirectory;
import com.ironcage.gateway.directory.AgentRecord;
import com.ironcage.gateway.exception.InvalidRequestException;
import com.ironcage.gateway.pricing.Money;
import com.ironcage.gateway.security.IssuedToken;
import com.ironcage.gateway.security.TokenIssuer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Provisioning hooks used by the management service: token issuance, rotation,
 * revocation and budget limit changes. Guarded by the admin API key filter.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/admin")
@Tag(name = "Admin", description = "Agent provisioning hooks")
public class AdminController {

    private final TokenIssuer tokenIssuer;
    private final AgentDirectory agentDirectory;
    private final BudgetLedger budgetLedger;

    public AdminController(TokenIssuer tokenIssuer, AgentDirectory agentDirectory, BudgetLedger budgetLedger) {
        this.tokenIssuer = tokenIssuer;
        this.agentDirectory = agentDirectory;
        this.budgetLedger = budgetLedger;
    }

    /**
     * Issues a new token for the agent. Any previous token stops working immediately.
     */
    @PostMapping("/agents/{agentId}/tokens")
    @Operation(summary = "Issue or rotate an agent token")
    public Mono<ResponseEntity<IssuedToken>> issueToken(@PathVariable String agentId,
                                                        @RequestBody(required = false) TokenRequest request) {
        List<String> scopes = request != null && request.scopes() != null ? request.scopes() : List.of();
        return tokenIssuer.issue(agentId, scopes)
                .map(ResponseEntity::ok);
    }

    @DeleteMapping("/tokens/{tokenId}")
    @Operation(summary = "Revoke a token")
    public Mono<ResponseEntity<Void>> revokeToken(@PathVariable String tokenId) {
        return tokenIssuer.revoke(tokenId)
                .then(Mono.fromSupplier(() -> ResponseEntity.noContent().<Void>build()));
    }

    @PutMapping("/agents/{agentId}/budget")
    @Operation(summary = "Change an agent's budget limit")
    public Mono<ResponseEntity<Map<String, Object>>> updateBudget(@PathVariable String agentId,
                                                                  @RequestBody BudgetLimitRequest request) {
        if (request == null || request.limitUsd() == null || request.limitUsd().signum() < 0) {
            return Mono.error(new InvalidRequestException("limitUsd must be a non-negative amount"));
        }
        long limitMicros = Money.usdToMicros(request.limitUsd());
        return agentDirectory.findAgent(agentId)
                .switchIfEmpty(Mono.error(new InvalidRequestException("Unknown agent " + agentId)))
                .map(agent -> {
                    agentDirectory.save(new AgentRecord(agent.agentId(), limitMicros,
                            agent.providerBindings(), agent.currentTokenId()));
                    budgetLedger.updateLimit(agentId, limitMicros);
                    log.info("Budget limit of agent {} set to {} USD", agentId, request.limitUsd());
                    return ResponseEntity.ok(Map.<String, Object>of(
                            "agentId", agentId,
                            "limitUsd", Money.toUsd(limitMicros)));
                });
    }

    public record TokenRequest(List<String> scopes) {
    }

    public record BudgetLimitRequest(BigDecimal limitUsd) {
    }
}

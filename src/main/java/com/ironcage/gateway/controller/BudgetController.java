package com.ironcage.gateway.controller;

import com.ironcage.gateway.budget.BudgetLedger;
import com.ironcage.gateway.budget.BudgetSnapshot;
import com.ironcage.gateway.pricing.Money;
import com.ironcage.gateway.security.TokenValidator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;

/**
 * Lets an agent read its own budget.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Budget", description = "Agent budget status")
public class BudgetController {

    private final TokenValidator tokenValidator;
    private final BudgetLedger budgetLedger;

    public BudgetController(TokenValidator tokenValidator, BudgetLedger budgetLedger) {
        this.tokenValidator = tokenValidator;
        this.budgetLedger = budgetLedger;
    }

    @GetMapping("/budget")
    @Operation(summary = "Budget of the authenticated agent",
            security = @SecurityRequirement(name = "agentToken"))
    public Mono<ResponseEntity<BudgetView>> budget(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return tokenValidator.validate(BearerToken.from(authorization))
                .flatMap(identity -> budgetLedger.snapshot(identity.agentId()))
                .map(BudgetView::of)
                .map(ResponseEntity::ok);
    }

    public record BudgetView(String agentId,
                             BigDecimal limitUsd,
                             BigDecimal spentUsd,
                             BigDecimal reservedUsd,
                             BigDecimal availableUsd) {

        static BudgetView of(BudgetSnapshot snapshot) {
            return new BudgetView(snapshot.agentId(),
                    Money.toUsd(snapshot.limitMicros()),
                    Money.toUsd(snapshot.spentMicros()),
                    Money.toUsd(snapshot.pendingMicros()),
                    Money.toUsd(snapshot.availableMicros()));
        }
    }
}

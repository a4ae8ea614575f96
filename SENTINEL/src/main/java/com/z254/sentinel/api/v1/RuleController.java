package com.z254.sentinel.api.v1;

import com.z254.sentinel.alerting.RuleEngine;
import com.z254.sentinel.domain.model.AlertRule;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * REST API controller for alert rules.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/rules")
@Tag(name = "Rules", description = "Alert rule management")
public class RuleController {

    private final RuleEngine ruleEngine;

    public RuleController(RuleEngine ruleEngine) {
        this.ruleEngine = ruleEngine;
    }

    @GetMapping
    @Operation(summary = "List rules", description = "List all alert rules")
    public Mono<ResponseEntity<List<AlertRule>>> listRules() {
        return Mono.fromCallable(() -> ResponseEntity.ok(ruleEngine.getRules()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get rule", description = "Get alert rule by ID")
    public Mono<ResponseEntity<AlertRule>> getRule(
            @Parameter(description = "Rule ID") @PathVariable String id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(ruleEngine.getRule(id)));
    }

    @PostMapping
    @Operation(summary = "Create rule", description = "Add a new alert rule")
    public Mono<ResponseEntity<AlertRule>> createRule(@RequestBody AlertRule rule) {
        log.info("Creating alert rule {} on metric {}", rule.getId(),
                rule.getCondition() != null ? rule.getCondition().getMetric() : null);
        return Mono.fromCallable(() -> ResponseEntity.status(HttpStatus.CREATED).body(ruleEngine.addRule(rule)));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update rule", description = "Replace an alert rule, keeping its evaluation state")
    public Mono<ResponseEntity<AlertRule>> updateRule(
            @Parameter(description = "Rule ID") @PathVariable String id,
            @RequestBody AlertRule rule) {
        return Mono.fromCallable(() -> ResponseEntity.ok(ruleEngine.updateRule(id, rule)));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete rule", description = "Remove an alert rule")
    public Mono<ResponseEntity<Void>> deleteRule(
            @Parameter(description = "Rule ID") @PathVariable String id) {
        return Mono.fromRunnable(() -> ruleEngine.removeRule(id))
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }

    @PostMapping("/{id}/evaluate")
    @Operation(summary = "Evaluate rule", description = "Evaluate one rule now and report the outcome")
    public Mono<ResponseEntity<Map<String, String>>> evaluateRule(
            @Parameter(description = "Rule ID") @PathVariable String id) {
        return Mono.fromCallable(() -> ResponseEntity.ok(
                Map.of("ruleId", id, "outcome", ruleEngine.evaluateRule(id).name())));
    }
}

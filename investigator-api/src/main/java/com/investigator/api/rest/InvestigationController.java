package com.investigator.api.rest;

import com.investigator.core.model.IncidentContext;
import com.investigator.core.model.InvestigationRecord;
import com.investigator.core.model.PrimitiveName;
import com.investigator.core.provider.ProviderCapability;
import com.investigator.core.provider.ResourceProvider;
import com.investigator.engine.planner.Strategy;
import com.investigator.engine.planner.StrategyTable;
import com.investigator.engine.primitive.DiagnosticPrimitive;
import com.investigator.engine.primitive.PrimitiveRegistry;
import com.investigator.engine.primitive.RequiredParameter;
import com.investigator.engine.service.InvestigationService;
import com.investigator.engine.service.InvestigationService.InvestigationRequest;
import java.time.Duration;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for incident investigations.
 */
@RestController
@RequestMapping("/api/v1/investigations")
public class InvestigationController {

    private final InvestigationService investigationService;
    private final ResourceProvider resourceProvider;
    private final StrategyTable strategyTable;
    private final PrimitiveRegistry primitiveRegistry;

    public InvestigationController(
            InvestigationService investigationService,
            ResourceProvider resourceProvider,
            StrategyTable strategyTable,
            PrimitiveRegistry primitiveRegistry) {
        this.investigationService = investigationService;
        this.resourceProvider = resourceProvider;
        this.strategyTable = strategyTable;
        this.primitiveRegistry = primitiveRegistry;
    }

    /**
     * Run an investigation synchronously and return its full record.
     */
    @PostMapping
    public ResponseEntity<InvestigationRecord> investigate(@RequestBody InvestigateRequestDto request) {
        if (request == null || request.query() == null || request.query().isBlank()) {
            throw new IllegalArgumentException("query is required");
        }
        InvestigationRecord record = investigationService.run(
            InvestigationRequest.of(request.query(), request.toHints()), resourceProvider);
        return ResponseEntity.ok(record);
    }

    /**
     * Describe the strategy table.
     */
    @GetMapping("/strategies")
    public ResponseEntity<List<StrategyResponse>> strategies() {
        List<StrategyResponse> responses = strategyTable.strategies().stream()
            .map(StrategyResponse::from)
            .toList();
        return ResponseEntity.ok(responses);
    }

    /**
     * Describe the registered primitives.
     */
    @GetMapping("/primitives")
    public ResponseEntity<List<PrimitiveResponse>> primitives() {
        List<PrimitiveResponse> responses = primitiveRegistry.names().stream()
            .map(primitiveRegistry::get)
            .map(PrimitiveResponse::from)
            .toList();
        return ResponseEntity.ok(responses);
    }

    // ========== DTOs ==========

    public record InvestigateRequestDto(
        String query,
        ContextDto context
    ) {
        IncidentContext toHints() {
            return context == null ? null : context.toContext();
        }
    }

    public record ContextDto(
        String resourceType,
        String resourceId,
        String metric,
        String scope,
        Integer lookbackMinutes
    ) {
        IncidentContext toContext() {
            return IncidentContext.builder()
                .resourceType(resourceType)
                .resourceId(resourceId)
                .metric(metric)
                .scope(scope)
                .lookbackWindow(lookbackMinutes == null ? null : Duration.ofMinutes(lookbackMinutes))
                .build();
        }
    }

    public record StrategyResponse(
        String incidentClass,
        String description,
        List<String> primitives,
        String defaultMetric,
        String rationale
    ) {
        static StrategyResponse from(Strategy strategy) {
            return new StrategyResponse(
                strategy.incidentClass().wireName(),
                strategy.incidentClass().description(),
                strategy.primitives().stream().map(PrimitiveName::wireName).toList(),
                strategy.defaultMetric(),
                strategy.rationale()
            );
        }
    }

    public record PrimitiveResponse(
        String name,
        List<ProviderCapability> requiredCapabilities,
        List<String> requiredParameters
    ) {
        static PrimitiveResponse from(DiagnosticPrimitive primitive) {
            return new PrimitiveResponse(
                primitive.name().wireName(),
                primitive.requiredCapabilities().stream().sorted().toList(),
                primitive.requiredParameters().stream().sorted().map(RequiredParameter::fieldName).toList()
            );
        }
    }
}

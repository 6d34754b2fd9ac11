package com.queryroute.controller;

import com.queryroute.api.EtlExecuteRequest;
import com.queryroute.api.EtlPlanRequest;
import com.queryroute.api.RouteRequest;
import com.queryroute.api.SourceSummary;
import com.queryroute.catalog.MetadataCatalog;
import com.queryroute.catalog.SourceRegistry;
import com.queryroute.model.DiscoveryResult;
import com.queryroute.model.EtlInstructions;
import com.queryroute.model.ExecutionResult;
import com.queryroute.model.ProcessedData;
import com.queryroute.service.EtlService;
import com.queryroute.service.MetadataDiscoveryService;
import com.queryroute.service.QueryRouter;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1")
public class QueryRouteController {

    private static final Logger log = LoggerFactory.getLogger(QueryRouteController.class);

    private final QueryRouter queryRouter;
    private final EtlService etlService;
    private final MetadataDiscoveryService discoveryService;
    private final SourceRegistry sourceRegistry;
    private final MetadataCatalog catalog;

    public QueryRouteController(
            QueryRouter queryRouter,
            EtlService etlService,
            MetadataDiscoveryService discoveryService,
            SourceRegistry sourceRegistry,
            MetadataCatalog catalog
    ) {
        this.queryRouter = queryRouter;
        this.etlService = etlService;
        this.discoveryService = discoveryService;
        this.sourceRegistry = sourceRegistry;
        this.catalog = catalog;
    }

    /**
     * Route a natural-language request across the registered sources.
     *
     * POST /v1/route
     *
     * @param request request text, source id and routing constraints
     * @return merged execution result; partial failures are reported inside it
     */
    @PostMapping("/route")
    public ResponseEntity<ExecutionResult> route(@Valid @RequestBody RouteRequest request) {
        log.info("Route request: source_id={}, names_only={}", request.getSourceId(), request.isNamesOnly());
        return ResponseEntity.ok(queryRouter.route(request.getRequest(), request.getSourceId(), request.toConstraints()));
    }

    /**
     * POST /v1/etl/plan
     */
    @PostMapping("/etl/plan")
    public ResponseEntity<List<EtlInstructions>> planEtl(@Valid @RequestBody EtlPlanRequest request) {
        return ResponseEntity.ok(etlService.plan(request.getRequirements(), request.getSourceId(),
                request.getAvailableFields(), request.getContext()));
    }

    /**
     * POST /v1/etl/execute
     */
    @PostMapping("/etl/execute")
    public ResponseEntity<ProcessedData> executeEtl(@Valid @RequestBody EtlExecuteRequest request) {
        return ResponseEntity.ok(etlService.executeEtl(request.getInstructions(), request.getSourceId(),
                request.getContext(), request.getOptions()));
    }

    @GetMapping("/sources")
    public ResponseEntity<List<SourceSummary>> listSources() {
        List<SourceSummary> sources = sourceRegistry.all().stream()
                .map(s -> SourceSummary.of(s, catalog.tables(s.getId()).size()))
                .toList();
        return ResponseEntity.ok(sources);
    }

    /**
     * Refresh the catalog of one source from its live schema.
     *
     * POST /v1/sources/{id}/discover
     */
    @PostMapping("/sources/{id}/discover")
    public ResponseEntity<DiscoveryResult> discover(@PathVariable("id") String sourceId) {
        return ResponseEntity.ok(discoveryService.discover(sourceId));
    }
}

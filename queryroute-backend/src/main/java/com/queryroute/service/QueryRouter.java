package com.queryroute.service;

import com.queryroute.analyzer.SemanticAnalyzer;
import com.queryroute.catalog.SourceRegistry;
import com.queryroute.execution.CrossSourceExecutor;
import com.queryroute.model.DatabaseQueryTask;
import com.queryroute.model.ExecutionResult;
import com.queryroute.model.PlaceholderRequirement;
import com.queryroute.model.QueryContext;
import com.queryroute.model.QueryPlan;
import com.queryroute.model.RouteConstraints;
import com.queryroute.model.TableCandidate;
import com.queryroute.routing.QueryCostOptimizer;
import com.queryroute.routing.QueryPlanner;
import com.queryroute.routing.QueryTaskGenerator;
import com.queryroute.routing.TableMatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Routes a natural-language request: analyze, match tables, plan, generate tasks, optimize, execute.
 */
@Slf4j
@Service
public class QueryRouter {
    private static final double FALLBACK_CONFIDENCE_FACTOR = 0.5;

    private final SourceRegistry registry;
    private final SemanticAnalyzer analyzer;
    private final TableMatcher matcher;
    private final QueryPlanner planner;
    private final QueryTaskGenerator generator;
    private final QueryCostOptimizer optimizer;
    private final CrossSourceExecutor executor;

    public QueryRouter(
            SourceRegistry registry,
            SemanticAnalyzer analyzer,
            TableMatcher matcher,
            QueryPlanner planner,
            QueryTaskGenerator generator,
            QueryCostOptimizer optimizer,
            CrossSourceExecutor executor
    ) {
        this.registry = registry;
        this.analyzer = analyzer;
        this.matcher = matcher;
        this.planner = planner;
        this.generator = generator;
        this.optimizer = optimizer;
        this.executor = executor;
    }

    public ExecutionResult route(String request, String sourceId, RouteConstraints constraints) {
        if (request == null || request.isBlank()) {
            throw new IllegalArgumentException("Request text is required");
        }
        RouteConstraints rc = constraints != null ? constraints : RouteConstraints.defaults();
        Set<String> sourceIds = new LinkedHashSet<>();
        sourceIds.add(registry.require(sourceId).getId());
        for (String extra : rc.getAdditionalSourceIds()) {
            sourceIds.add(registry.require(extra).getId());
        }

        QueryContext context = analyzer.analyze(request);
        int maxTables = rc.getMaxTables() != null && rc.getMaxTables() > 0 ? rc.getMaxTables() : matcher.getDefaultMaxTables();

        List<TableCandidate> candidates = new ArrayList<>();
        for (String id : sourceIds) {
            candidates.addAll(matcher.findRelevantTables(context, id, rc.getExplicitTables(), maxTables, rc.isNamesOnly()));
        }
        candidates.sort(TableMatcher.RANKING);
        if (candidates.size() > maxTables) {
            candidates = new ArrayList<>(candidates.subList(0, maxTables));
        }

        QueryPlan plan = planner.createPlan(context, candidates, sourceId);
        List<DatabaseQueryTask> tasks = new ArrayList<>(generator.generateTasks(plan));
        optimizer.optimize(tasks);

        ExecutionResult result = executor.execute(tasks, plan, rc);

        double confidence = plan.isFallback() ? context.getConfidence() * FALLBACK_CONFIDENCE_FACTOR : context.getConfidence();
        result.getMetadata().put("confidence", confidence);
        result.getMetadata().put("fallback", plan.isFallback());
        result.getMetadata().put("intent", context.getIntent().wireName());
        result.getMetadata().put("entities", List.copyOf(context.getEntities()));
        result.getMetadata().put("tables", plan.allTables().stream().map(TableCandidate::getTableName).toList());
        result.getMetadata().put("cross_database", plan.isCrossDatabase());
        result.getPerformanceStats().put("complexity", plan.getComplexity().wireName());
        log.info("Routed request: source_id={}, intent={}, tables={}, tasks={}, success={}, fallback={}",
                sourceId, context.getIntent(), plan.allTables().size(), tasks.size(), result.isSuccess(), plan.isFallback());
        return result;
    }

    /**
     * Routes the description of a report placeholder and tags the result with the placeholder.
     */
    public ExecutionResult routeRequirement(PlaceholderRequirement requirement, String sourceId, RouteConstraints constraints) {
        if (requirement == null) {
            throw new IllegalArgumentException("Requirement is required");
        }
        ExecutionResult result = route(requirement.getDescription(), sourceId, constraints);
        result.getMetadata().put("placeholder_name", requirement.getName());
        if (requirement.getCategory() != null) {
            result.getMetadata().put("placeholder_category", requirement.getCategory().wireName());
        }
        return result;
    }
}

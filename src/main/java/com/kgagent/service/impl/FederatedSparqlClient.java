package com.kgagent.service.impl;

import com.kgagent.config.KgAgentProperties;
import com.kgagent.dto.request.ExecutionRequest;
import com.kgagent.dto.response.ExecutionResponse;
import com.kgagent.exception.KgAgentException;
import com.kgagent.exception.QueryExecutionException;
import com.kgagent.exception.QueryTimeoutException;
import com.kgagent.model.ContextPack;
import com.kgagent.model.ExecutionErrorKind;
import com.kgagent.model.GraphMode;
import com.kgagent.model.SparqlResult;
import com.kgagent.service.api.CredentialService;
import com.kgagent.service.api.QueryRepairService;
import com.kgagent.service.api.SparqlExecutionClient;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Sends queries to FRINK endpoints.
 * <p>
 * Single mode targets the first graph's own endpoint; federated mode targets the pack's federation
 * endpoint and scopes the query to the requested graphs with {@code FROM} clauses when the query
 * does not scope itself. A query the endpoint rejects (HTTP 4xx) gets exactly one repair attempt.
 */
@Service
@Slf4j
public class FederatedSparqlClient implements SparqlExecutionClient {

    static final MediaType SPARQL_RESULTS_JSON = MediaType.parseMediaType("application/sparql-results+json");

    private static final Pattern FROM_CLAUSE = Pattern.compile("(?im)^\\s*FROM\\s+(NAMED\\s+)?<");
    private static final Pattern SERVICE_CLAUSE = Pattern.compile("(?i)\\bSERVICE\\s+<");
    private static final Pattern WHERE_OPEN = Pattern.compile("(?i)\\bWHERE\\s*\\{");

    private final WebClient webClient;
    private final QueryRepairService repairService;
    private final CredentialService credentialService;
    private final KgAgentProperties properties;

    public FederatedSparqlClient(WebClient webClient, QueryRepairService repairService,
                                 CredentialService credentialService, KgAgentProperties properties) {
        this.webClient = webClient;
        this.repairService = repairService;
        this.credentialService = credentialService;
        this.properties = properties;
    }

    @Override
    public Mono<ExecutionResponse> execute(ExecutionRequest request, ContextPack pack) {
        return Mono.defer(() -> {
            Route route = route(request, pack);
            String query = route.federated() ? scopeToGraphs(request.query(), request.graphs(), pack) : request.query();
            long started = System.currentTimeMillis();
            boolean repairAllowed = request.repair() && properties.getExecution().isRepairEnabled();

            return send(query, route)
                    .map(result -> response(request, route, query, result, false, started))
                    .onErrorResume(QueryExecutionException.class, e -> {
                        if (!repairAllowed || !e.isRepairable()) {
                            return Mono.error(e);
                        }
                        return repairOnce(query, e)
                                .flatMap(repaired -> send(repaired, route)
                                        .map(result -> response(request, route, repaired, result, true, started)))
                                .switchIfEmpty(Mono.error(e));
                    });
        });
    }

    /**
     * One rewrite of the rejected query, or empty when the repair produced nothing new.
     */
    private Mono<String> repairOnce(String query, QueryExecutionException failure) {
        return Mono.fromCallable(() -> repairService.repair(query, failure.getMessage()).orElse(null))
                .subscribeOn(Schedulers.boundedElastic())
                .filter(repaired -> !repaired.isBlank() && !repaired.strip().equals(query.strip()))
                .doOnNext(repaired -> log.info("Retrying rejected query once after repair"))
                .onErrorResume(KgAgentException.class, e -> {
                    log.warn("Query repair failed: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    private Mono<SparqlResult> send(String query, Route route) {
        Duration timeout = properties.getExecution().getTimeout();
        log.debug("POST {}\n{}", route.endpoint(), query);

        WebClient.RequestBodySpec spec = webClient.post()
                .uri(route.endpoint())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(SPARQL_RESULTS_JSON, MediaType.APPLICATION_JSON);
        String token = route.graph() == null ? null : credentialService.getCredential(route.graph());
        if (token != null) {
            spec = spec.header(HttpHeaders.AUTHORIZATION, "Bearer " + token);
        }

        return spec.body(BodyInserters.fromFormData("query", query))
                .retrieve()
                .bodyToMono(SparqlResult.class)
                .defaultIfEmpty(new SparqlResult())
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new QueryTimeoutException(route.endpoint(), timeout, e))
                .onErrorMap(WebClientResponseException.class, e -> translate(route.endpoint(), e))
                .onErrorMap(WebClientRequestException.class, e -> new QueryExecutionException(ExecutionErrorKind.TRANSPORT,
                        route.endpoint(), "Could not reach " + route.endpoint() + ": " + e.getMessage(), e));
    }

    private static QueryExecutionException translate(String endpoint, WebClientResponseException e) {
        String body = e.getResponseBodyAsString();
        String detail = body == null || body.isBlank() ? e.getStatusText() : body.strip();
        if (e.getStatusCode().is4xxClientError()) {
            return new QueryExecutionException(ExecutionErrorKind.QUERY_ERROR, endpoint,
                    "Endpoint " + endpoint + " rejected the query (" + e.getStatusCode().value() + "): " + detail, e);
        }
        return new QueryExecutionException(ExecutionErrorKind.TRANSPORT, endpoint,
                "Endpoint " + endpoint + " failed (" + e.getStatusCode().value() + "): " + detail, e);
    }

    private static ExecutionResponse response(ExecutionRequest request, Route route, String executed,
                                              SparqlResult result, boolean repaired, long started) {
        ExecutionResponse.ExecutionResponseBuilder builder = ExecutionResponse.builder()
                .result(result)
                .repaired(repaired)
                .elapsedMs(System.currentTimeMillis() - started);
        if (request.debug()) {
            builder.executedQuery(executed).endpointUsed(route.endpoint());
        }
        return builder.build();
    }

    static Route route(ExecutionRequest request, ContextPack pack) {
        List<String> graphs = request.graphs() == null ? List.of() : request.graphs();
        if (request.mode() == GraphMode.SINGLE) {
            if (graphs.isEmpty()) {
                throw new KgAgentException("Single-graph execution needs a target graph.");
            }
            String graph = graphs.get(0);
            return new Route(pack.requireGraph(graph).getEndpoint(), graph, false);
        }
        String federation = pack.getFederationEndpoint();
        if (federation == null || federation.isBlank()) {
            throw new KgAgentException("Context pack '" + pack.getId() + "' has no federation endpoint.");
        }
        return new Route(federation, graphs.size() == 1 ? graphs.get(0) : null, true);
    }

    /**
     * Adds one {@code FROM <iri>} per graph before the first {@code WHERE {}} unless the query
     * already has a dataset clause or delegates with {@code SERVICE}.
     */
    static String scopeToGraphs(String query, List<String> graphs, ContextPack pack) {
        if (graphs == null || graphs.isEmpty()
                || FROM_CLAUSE.matcher(query).find()
                || SERVICE_CLAUSE.matcher(query).find()) {
            return query;
        }
        Matcher where = WHERE_OPEN.matcher(query);
        if (!where.find()) {
            return query;
        }
        String fromLines = graphs.stream()
                .map(graph -> "FROM <" + pack.requireGraph(graph).getIri() + ">\n")
                .collect(Collectors.joining());
        return query.substring(0, where.start()) + fromLines + query.substring(where.start());
    }

    /**
     * Where a query goes. {@code graph} is the graph whose stored credential applies, if any.
     */
    record Route(String endpoint, String graph, boolean federated) {
    }
}

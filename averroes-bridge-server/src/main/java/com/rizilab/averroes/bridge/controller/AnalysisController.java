package com.rizilab.averroes.bridge.controller;

import com.rizilab.averroes.bridge.config.CoreProperties;
import com.rizilab.averroes.bridge.domain.CallResult;
import com.rizilab.averroes.bridge.domain.ErrorInfo;
import com.rizilab.averroes.bridge.domain.LifecycleState;
import com.rizilab.averroes.bridge.domain.QueryRequest;
import com.rizilab.averroes.bridge.domain.QueryResponse;
import com.rizilab.averroes.bridge.domain.SystemStatus;
import com.rizilab.averroes.bridge.exception.BridgeException;
import com.rizilab.averroes.bridge.service.QueryFacade;
import com.rizilab.averroes.bridge.service.SystemLifecycle;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Analysis Controller - HTTP access to the query facade and the native core lifecycle
 */
@Slf4j
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class AnalysisController {

    private final QueryFacade queryFacade;
    private final SystemLifecycle lifecycle;
    private final CoreProperties properties;

    public AnalysisController(QueryFacade queryFacade, SystemLifecycle lifecycle, CoreProperties properties) {
        this.queryFacade = queryFacade;
        this.lifecycle = lifecycle;
        this.properties = properties;
    }

    /**
     * Analyze a query
     * POST /api/analyze
     */
    @PostMapping("/analyze")
    public CompletableFuture<ResponseEntity<Object>> analyze(@RequestBody AnalyzeRequest body) {
        QueryRequest request;
        try {
            request = body.toQueryRequest();
        } catch (IllegalArgumentException e) {
            log.warn("Rejected analysis request: {}", e.getMessage());
            return CompletableFuture.completedFuture(
                    ErrorResponses.of(ErrorInfo.invalidQuery("audioBase64 is not valid Base64")));
        }

        log.info("Analysis request: kind={}, payloadSize={}", request.getKind(), request.payloadSize());
        return queryFacade.analyze(request)
                .thenApply(AnalysisController::toResponse)
                .exceptionally(error -> {
                    log.error("Error processing analysis request", error);
                    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .body(Map.of("error", "Internal server error", "detail", String.valueOf(error.getMessage())));
                });
    }

    /**
     * Current lifecycle state
     * GET /api/system/status
     */
    @GetMapping("/system/status")
    public SystemStatus status() {
        return lifecycle.status();
    }

    /**
     * Tear down and re-initialize the native core with the configured settings
     * POST /api/system/restart
     */
    @PostMapping("/system/restart")
    public CompletableFuture<ResponseEntity<Object>> restart() {
        log.info("Restart requested over HTTP");
        return lifecycle.restart(properties.toCoreConfig())
                .<ResponseEntity<Object>>handle((state, error) -> {
                    if (error == null) {
                        return ResponseEntity.ok().<Object>body(stateBody(state));
                    }
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    if (cause instanceof BridgeException bridgeException) {
                        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                                .<Object>body(ErrorResponses.body(bridgeException.getErrorInfo()));
                    }
                    log.error("Restart failed", cause);
                    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .<Object>body(Map.of("error", "Internal server error", "detail", String.valueOf(cause.getMessage())));
                });
    }

    private static ResponseEntity<Object> toResponse(CallResult<QueryResponse> result) {
        if (result.isSuccess()) {
            return ResponseEntity.ok(result.getValue());
        }
        ErrorInfo error = result.getError();
        log.warn("Analysis failed: kind={}, message={}", error.getKind(), error.getMessage());
        return ErrorResponses.of(error);
    }

    private static Map<String, Object> stateBody(LifecycleState state) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", state.getStatus());
        state.reason().ifPresent(reason -> body.put("reason", reason));
        return body;
    }
}

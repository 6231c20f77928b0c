package com.scaniq.collector.controller;

import com.scaniq.collector.client.SearchProvider;
import com.scaniq.collector.dto.CapabilitiesResponse;
import com.scaniq.collector.dto.CollectionRequest;
import com.scaniq.collector.dto.CollectionResult;
import com.scaniq.collector.dto.EvidenceItem;
import com.scaniq.collector.service.EvidenceCollectorService;
import com.scaniq.collector.service.sink.EvidenceSink;
import com.scaniq.collector.service.tool.ToolExecutor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Controller for evidence collection runs.
 * Provides endpoints for:
 * - Running a collection for a company domain
 * - Retrieving the evidence of a finished collection
 * - Listing the registered collection tools
 */
@RestController
@RequestMapping("/api/v1/evidence-collections")
@RequiredArgsConstructor
@Slf4j
public class EvidenceCollectionController {

    private final EvidenceCollectorService collectorService;
    private final EvidenceSink evidenceSink;
    private final ToolExecutor toolExecutor;
    private final SearchProvider searchProvider;

    /**
     * Run a collection and return its evidence, audit trail and summary.
     *
     * @param request domain, company name, optional thesis and depth
     * @return the collection result; {@code success=false} when the run failed midway
     */
    @PostMapping
    public Mono<ResponseEntity<CollectionResult>> collect(@Valid @RequestBody CollectionRequest request) {
        log.info("Collection requested for {} ({})", request.getCompanyName(), request.getDomain());
        return collectorService.collect(request).map(ResponseEntity::ok);
    }

    @GetMapping("/{collectionId}/evidence")
    public ResponseEntity<List<EvidenceItem>> getEvidence(@PathVariable String collectionId) {
        return evidenceSink.find(collectionId)
                .map(result -> ResponseEntity.ok(result.evidence()))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/capabilities")
    public ResponseEntity<CapabilitiesResponse> getCapabilities() {
        List<CapabilitiesResponse.ToolInfo> tools = toolExecutor.getCapabilities().entrySet().stream()
                .map(e -> new CapabilitiesResponse.ToolInfo(
                        e.getKey().getCode(), e.getKey().getDescription(), e.getValue().isAvailable()))
                .toList();
        return ResponseEntity.ok(new CapabilitiesResponse(tools, searchProvider.isAvailable(), searchProvider.getName()));
    }
}

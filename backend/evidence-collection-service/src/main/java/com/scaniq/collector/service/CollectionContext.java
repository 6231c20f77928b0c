package com.scaniq.collector.service;

import com.scaniq.collector.config.EvidenceCollectionConfig.DepthProfile;
import com.scaniq.collector.entity.InvestmentThesis;
import com.scaniq.collector.service.audit.AuditTrail;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State of a single collection run, passed explicitly to every stage.
 */
@Getter
@Builder
public class CollectionContext {

    private final String collectionId;
    private final String domain;
    private final String companyName;
    /** null when the request carries no recognised thesis */
    private final InvestmentThesis thesis;
    private final DepthProfile profile;
    private final AuditTrail auditTrail;
    private final EvidenceStore evidenceStore;
    @Builder.Default
    private final Instant startedAt = Instant.now();
    @Builder.Default
    private final AtomicInteger urlsProcessed = new AtomicInteger();
    /** Pages confirmed by discovery, appended as they are found */
    @Builder.Default
    private final List<String> discoveredUrls = new CopyOnWriteArrayList<>();

    public static CollectionContext create(String collectionId, String domain, String companyName,
                                           InvestmentThesis thesis, DepthProfile profile) {
        return CollectionContext.builder()
                .collectionId(collectionId)
                .domain(domain)
                .companyName(companyName)
                .thesis(thesis)
                .profile(profile)
                .auditTrail(new AuditTrail(collectionId))
                .evidenceStore(new EvidenceStore())
                .build();
    }
}

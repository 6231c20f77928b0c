package com.scaniq.collector.dto;

import com.scaniq.collector.entity.CollectionDepth;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for starting an evidence collection
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollectionRequest {

    @NotBlank(message = "Domain is required")
    private String domain;

    @NotBlank(message = "Company name is required")
    private String companyName;

    /**
     * Optional investment thesis tag, e.g. "digital-transformation".
     */
    private String investmentThesis;

    @Builder.Default
    private CollectionDepth depth = CollectionDepth.COMPREHENSIVE;
}

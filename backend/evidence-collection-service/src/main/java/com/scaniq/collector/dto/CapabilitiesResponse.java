package com.scaniq.collector.dto;

import java.util.List;

/**
 * Registered collection tools and whether web search is configured.
 */
public record CapabilitiesResponse(List<ToolInfo> tools, boolean searchAvailable, String searchProvider) {

    public record ToolInfo(String code, String description, boolean available) {}
}

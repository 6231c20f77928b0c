package com.scaniq.collector.dto;

/**
 * One web search result.
 */
public record SearchHit(String title, String url, String snippet) {
}

package com.scaniq.collector.service.crawler;

public record CrawlReport(int urlsProcessed, int evidenceCollected) {
}

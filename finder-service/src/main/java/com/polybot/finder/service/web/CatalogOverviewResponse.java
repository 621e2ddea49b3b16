package com.polybot.finder.service.web;

import java.time.Instant;
import java.util.List;

public record CatalogOverviewResponse(
    int marketCount,
    Instant capturedAt,
    boolean fresh,
    long ttlSeconds,
    String contains,
    int matchingCount,
    List<String> questions
) {
}

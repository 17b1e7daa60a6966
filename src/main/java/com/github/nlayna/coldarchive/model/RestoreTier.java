package com.github.nlayna.coldarchive.model;

/**
 * Retrieval speed/cost option for archived objects. Latency estimates are for deep archive storage.
 */
public enum RestoreTier {
    EXPEDITED("Fastest retrieval option", "1-5 minutes", "high"),
    STANDARD("Balanced retrieval option", "3-5 hours", "medium"),
    BULK("Cheapest retrieval option", "5-12 hours", "low");

    private final String description;
    private final String estimatedTime;
    private final String cost;

    RestoreTier(String description, String estimatedTime, String cost) {
        this.description = description;
        this.estimatedTime = estimatedTime;
        this.cost = cost;
    }

    public RestoreTierInfo info() {
        return new RestoreTierInfo(this, description, estimatedTime, cost);
    }

    public record RestoreTierInfo(RestoreTier tier, String description, String estimatedTime, String cost) {
    }
}

package com.github.nlayna.coldarchive.model;

import java.util.List;

public record PartPlan(long fileSize, long chunkSize, List<PartRange> parts) {

    public PartPlan {
        parts = List.copyOf(parts);
    }

    public boolean isMultipart() {
        return parts.size() > 1;
    }

    public PartRange part(int partNumber) {
        if (partNumber < 1 || partNumber > parts.size()) {
            return null;
        }
        return parts.get(partNumber - 1);
    }
}

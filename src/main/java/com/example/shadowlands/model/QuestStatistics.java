package com.example.shadowlands.model;

public record QuestStatistics(int activeCount, int completedCount, int failedCount, int level) {

    public int totalCount() {
        return activeCount + completedCount + failedCount;
    }
}

package com.example.auditcore.service;

public record PurgeResult(
        long noiseCutoff,
        long importantCutoff,
        int noisePurged,
        int importantPurged,
        int failed
) {

    public int totalPurged() {
        return noisePurged + importantPurged;
    }
}

package com.example.auditcore.http;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PurgeResponse(
        @JsonProperty("noise_cutoff") long noiseCutoff,
        @JsonProperty("important_cutoff") long importantCutoff,
        @JsonProperty("noise_purged") int noisePurged,
        @JsonProperty("important_purged") int importantPurged,
        @JsonProperty("failed") int failed
) { }

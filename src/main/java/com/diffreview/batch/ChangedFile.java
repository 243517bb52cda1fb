package com.diffreview.batch;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One changed file as delivered by the diff source. {@code patch} is null for binary or oversized files.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChangedFile(String filename, String status, String patch) {

    public boolean hasPatch() {
        return patch != null && !patch.isEmpty();
    }
}

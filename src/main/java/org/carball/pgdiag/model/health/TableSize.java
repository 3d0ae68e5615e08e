package org.carball.pgdiag.model.health;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TableSize(
        @JsonProperty("table") String table,
        @JsonProperty("size_bytes") long sizeBytes
) {
}

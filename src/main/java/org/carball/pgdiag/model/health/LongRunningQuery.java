package org.carball.pgdiag.model.health;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

public record LongRunningQuery(
        @JsonProperty("pid") int pid,
        @JsonProperty("duration") Duration duration,
        @JsonProperty("query") String query
) {
}

package org.carball.pgdiag.model.health;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * One row of pg_stat_replication. A null replay lag means the standby reported none.
 */
public record ReplicaStatus(
        @JsonProperty("application_name") String name,
        @JsonProperty("replay_lag") Duration replayLag
) {

    @JsonIgnore
    public Duration effectiveLag() {
        return replayLag != null ? replayLag : Duration.ZERO;
    }
}

package org.carball.pgdiag.model.health;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record TableDeadTuples(
        @JsonProperty("table") String table,
        @JsonProperty("n_dead_tup") long deadTuples,
        @JsonProperty("n_live_tup") long liveTuples
) {

    /** Dead tuples relative to live tuples; 0 for a table with no live rows. */
    @JsonIgnore
    public double deadTupleRatio() {
        return liveTuples > 0 ? (double) deadTuples / liveTuples : 0.0;
    }
}

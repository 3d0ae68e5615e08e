package org.carball.pgdiag.model.health;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Estimated wasted fraction of a table's storage, in [0, 1].
 */
public record TableBloat(
        @JsonProperty("table") String table,
        @JsonProperty("bloat_ratio") double bloatRatio
) {
}

package com.waterly.store.migration;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record AppliedMigration(
    @JsonProperty("installed_rank") int installedRank,
    String version,
    String description,
    String checksum,
    @JsonProperty("installed_on") Instant installedOn
) {}

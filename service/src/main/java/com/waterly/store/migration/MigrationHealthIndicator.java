package com.waterly.store.migration;

import java.util.List;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component("migrations")
public class MigrationHealthIndicator implements HealthIndicator {
  private final MigrationLedger ledger;

  public MigrationHealthIndicator(MigrationLedger ledger) {
    this.ledger = ledger;
  }

  @Override
  public Health health() {
    try {
      List<AppliedMigration> history = ledger.history();
      String latest = history.stream()
          .filter(row -> row.version() != null)
          .reduce((first, second) -> second)
          .map(AppliedMigration::version)
          .orElse("none");
      return Health.up()
          .withDetail("applied", history.size())
          .withDetail("latestVersion", latest)
          .build();
    } catch (DataAccessException ex) {
      return Health.down(ex).build();
    }
  }
}

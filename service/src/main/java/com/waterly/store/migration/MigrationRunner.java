package com.waterly.store.migration;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.stereotype.Component;

/**
 * Brings the schema up to date while the application context starts. Store components depend on
 * this bean, so they only become available once every pending migration has been applied; a
 * failure stops the context.
 */
@Component("migrationRunner")
public class MigrationRunner implements InitializingBean {
  private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

  private final MigrationScanner scanner;
  private final MigrationLedger ledger;

  public MigrationRunner(MigrationScanner scanner, MigrationLedger ledger) {
    this.scanner = scanner;
    this.ledger = ledger;
  }

  @Override
  public void afterPropertiesSet() {
    List<Migration> known = scanner.scan();
    List<AppliedMigration> applied = ledger.migrate(known);
    List<AppliedMigration> history = ledger.history();
    String current = history.stream()
        .filter(row -> row.version() != null)
        .reduce((first, second) -> second)
        .map(AppliedMigration::version)
        .orElse("none");
    log.info("Database at schema version {} ({} ledger rows, {} applied this run)",
        current, history.size(), applied.size());
  }
}

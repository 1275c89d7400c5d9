package com.waterly.store.migration;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Append-only record of applied schema changes. Every structural change to the store goes through
 * {@link #apply(Migration)}, which runs the script and writes the ledger row in one transaction.
 */
@Component
public class MigrationLedger {
  private static final Logger log = LoggerFactory.getLogger(MigrationLedger.class);

  private static final String CREATE_TABLE = """
      CREATE TABLE IF NOT EXISTS migration_history (
        installed_rank  INTEGER PRIMARY KEY,
        version         TEXT UNIQUE,
        description     TEXT NOT NULL,
        checksum        TEXT NOT NULL UNIQUE,
        installed_on    TIMESTAMPTZ NOT NULL DEFAULT now()
      )
      """;

  private static final String SELECT_COLUMNS =
      "SELECT installed_rank, version, description, checksum, installed_on FROM migration_history";

  private static final RowMapper<AppliedMigration> ROW_MAPPER = MigrationLedger::mapRow;

  private final JdbcTemplate jdbc;
  private final TransactionTemplate tx;

  public MigrationLedger(JdbcTemplate jdbc, TransactionTemplate tx) {
    this.jdbc = jdbc;
    this.tx = tx;
  }

  public void ensureTable() {
    jdbc.execute(CREATE_TABLE);
  }

  public List<AppliedMigration> history() {
    return jdbc.query(SELECT_COLUMNS + " ORDER BY installed_rank", ROW_MAPPER);
  }

  public List<Migration> pending(List<Migration> known) {
    Set<String> applied = new HashSet<>(
        jdbc.queryForList("SELECT checksum FROM migration_history", String.class));
    return MigrationPlanner.pending(known, applied);
  }

  /**
   * Applies one migration atomically.
   *
   * @return the new ledger row, or empty when the same migration is already recorded
   * @throws MigrationException on a version or checksum conflict, or when the script fails; in
   *     both cases nothing is changed
   */
  public Optional<AppliedMigration> apply(Migration migration) {
    try {
      return tx.execute(status -> applyInTransaction(migration));
    } catch (MigrationException ex) {
      throw ex;
    } catch (DataAccessException ex) {
      throw new MigrationException("Migration " + migration.displayName()
          + " failed and was rolled back: " + ex.getMostSpecificCause().getMessage(), ex);
    }
  }

  /**
   * Applies every pending migration in the order given. Stops at the first failure.
   */
  public List<AppliedMigration> migrate(List<Migration> known) {
    ensureTable();
    List<Migration> pending = pending(known);
    if (pending.isEmpty()) {
      log.info("Schema is up to date; {} migrations offered, none pending", known.size());
      return List.of();
    }
    log.info("Applying {} pending migrations", pending.size());
    List<AppliedMigration> applied = new ArrayList<>(pending.size());
    for (Migration migration : pending) {
      apply(migration).ifPresent(applied::add);
    }
    return applied;
  }

  private Optional<AppliedMigration> applyInTransaction(Migration migration) {
    jdbc.execute("LOCK TABLE migration_history IN EXCLUSIVE MODE");

    Optional<AppliedMigration> sameContent = findOne(" WHERE checksum = ?", migration.checksum());
    if (sameContent.isPresent()) {
      AppliedMigration existing = sameContent.get();
      if (sameVersion(existing, migration)) {
        log.info("Migration {} already applied at rank {}", migration.displayName(),
            existing.installedRank());
        return Optional.empty();
      }
      throw new MigrationException("Migration " + migration.displayName() + " has checksum "
          + migration.checksum() + " already recorded for version " + existing.version()
          + " (" + existing.description() + ")");
    }

    if (!migration.repeatable()) {
      Optional<AppliedMigration> recorded = jdbc.query(
              SELECT_COLUMNS + " WHERE version IS NOT NULL", ROW_MAPPER).stream()
          .filter(row -> sameVersion(row, migration))
          .findFirst();
      if (recorded.isPresent()) {
        throw new MigrationException("Schema drift: version " + recorded.get().version()
            + " was applied with checksum " + recorded.get().checksum()
            + " but " + migration.versionLabel() + " is now offered with checksum "
            + migration.checksum());
      }
    }

    log.info("Running migration {}", migration.displayName());
    jdbc.execute(migration.script());

    Integer rank = jdbc.queryForObject(
        "SELECT COALESCE(MAX(installed_rank), 0) + 1 FROM migration_history", Integer.class);
    AppliedMigration applied = jdbc.queryForObject(
        """
        INSERT INTO migration_history (installed_rank, version, description, checksum)
        VALUES (?, ?, ?, ?)
        RETURNING installed_rank, version, description, checksum, installed_on
        """,
        ROW_MAPPER,
        rank, migration.versionLabel(), migration.description(), migration.checksum());
    log.info("Migration {} completed at rank {}", migration.displayName(), rank);
    return Optional.ofNullable(applied);
  }

  private Optional<AppliedMigration> findOne(String where, String value) {
    return jdbc.query(SELECT_COLUMNS + where, ROW_MAPPER, value).stream().findFirst();
  }

  private static boolean sameVersion(AppliedMigration row, Migration migration) {
    if (row.version() == null || migration.repeatable()) {
      return row.version() == null && migration.repeatable();
    }
    return MigrationVersion.parse(row.version()).equals(migration.version());
  }

  private static AppliedMigration mapRow(ResultSet rs, int rowNum) throws SQLException {
    Timestamp installedOn = rs.getTimestamp("installed_on");
    return new AppliedMigration(
        rs.getInt("installed_rank"),
        rs.getString("version"),
        rs.getString("description"),
        rs.getString("checksum"),
        installedOn != null ? installedOn.toInstant() : null);
  }
}

package com.waterly.store.migration;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reconciles offered migrations against the ledger. Membership is decided by checksum only, so a
 * migration already applied is skipped even when offered again, and a repeatable migration whose
 * content changed shows up as pending.
 */
public final class MigrationPlanner {
  private MigrationPlanner() {
  }

  public static List<Migration> pending(List<Migration> known, Set<String> appliedChecksums) {
    List<Migration> out = new ArrayList<>(known.size());
    for (Migration migration : known) {
      if (!appliedChecksums.contains(migration.checksum())) {
        out.add(migration);
      }
    }
    return out;
  }
}

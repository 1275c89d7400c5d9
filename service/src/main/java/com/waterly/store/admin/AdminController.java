package com.waterly.store.admin;

import com.waterly.store.migration.AppliedMigration;
import com.waterly.store.migration.MigrationLedger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
@Tag(name = "Admin")
public class AdminController {
  private final MigrationLedger ledger;

  public AdminController(MigrationLedger ledger) {
    this.ledger = ledger;
  }

  @GetMapping("/migrations")
  @Operation(summary = "Migration history", description = "Applied migrations by installation rank.")
  public List<AppliedMigration> migrations() {
    return ledger.history();
  }
}

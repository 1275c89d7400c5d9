package com.waterly.store.migration;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ChecksumsTest {

  @Test
  void sha256IsLowercaseHex() {
    assertThat(Checksums.sha256("abc"))
        .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
  }

  @Test
  void whitespaceChangesTheChecksum() {
    assertThat(Checksums.sha256("SELECT 1;")).isNotEqualTo(Checksums.sha256("SELECT 1; "));
  }
}

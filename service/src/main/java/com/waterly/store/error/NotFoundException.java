package com.waterly.store.error;

import java.util.NoSuchElementException;

public class NotFoundException extends NoSuchElementException {
  private final String entity;
  private final String key;

  public NotFoundException(String entity, String key) {
    super(entity + " not found: " + key);
    this.entity = entity;
    this.key = key;
  }

  public String entity() {
    return entity;
  }

  public String key() {
    return key;
  }
}

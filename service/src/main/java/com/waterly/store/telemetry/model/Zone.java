package com.waterly.store.telemetry.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "zone")
public class Zone {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(nullable = false, unique = true, updatable = false)
  private String name;

  private String description;

  @Column(name = "rh_sensor_address")
  private Integer humiditySensorAddress;

  @Column(name = "npk_sensor_address")
  private Integer npkSensorAddress;

  @Column(name = "relay_address")
  private Integer relayAddress;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at")
  private Instant updatedAt;

  public Zone() {
    // JPA default constructor
  }

  public static Zone named(String name) {
    Zone zone = new Zone();
    zone.name = name;
    return zone;
  }

  public Zone withHardware(Integer humiditySensorAddress, Integer npkSensorAddress,
      Integer relayAddress) {
    this.humiditySensorAddress = humiditySensorAddress;
    this.npkSensorAddress = npkSensorAddress;
    this.relayAddress = relayAddress;
    return this;
  }

  public Zone describedAs(String description) {
    this.description = description;
    return this;
  }

  /**
   * Copies the mutable attributes of {@code other}. Name, id and timestamps are left alone.
   */
  public void copyAttributesFrom(Zone other) {
    this.description = other.description;
    this.humiditySensorAddress = other.humiditySensorAddress;
    this.npkSensorAddress = other.npkSensorAddress;
    this.relayAddress = other.relayAddress;
  }

  public Long getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public Integer getHumiditySensorAddress() {
    return humiditySensorAddress;
  }

  public void setHumiditySensorAddress(Integer humiditySensorAddress) {
    this.humiditySensorAddress = humiditySensorAddress;
  }

  public Integer getNpkSensorAddress() {
    return npkSensorAddress;
  }

  public void setNpkSensorAddress(Integer npkSensorAddress) {
    this.npkSensorAddress = npkSensorAddress;
  }

  public Integer getRelayAddress() {
    return relayAddress;
  }

  public void setRelayAddress(Integer relayAddress) {
    this.relayAddress = relayAddress;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public void setCreatedAt(Instant createdAt) {
    this.createdAt = createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void setUpdatedAt(Instant updatedAt) {
    this.updatedAt = updatedAt;
  }
}

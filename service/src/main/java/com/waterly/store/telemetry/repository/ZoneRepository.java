package com.waterly.store.telemetry.repository;

import com.waterly.store.telemetry.model.Zone;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ZoneRepository extends JpaRepository<Zone, Long> {

  Optional<Zone> findByName(String name);

  List<Zone> findAllByOrderByNameAsc();
}

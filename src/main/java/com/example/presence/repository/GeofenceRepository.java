package com.example.presence.repository;

import com.example.presence.entities.Geofence;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface GeofenceRepository extends JpaRepository<Geofence, Long> {

    Optional<Geofence> findByName(String name);

    // evaluation priority: smallest margin first, then insertion order
    List<Geofence> findByActiveTrueOrderByMarginMetersAscIdAsc();

    List<Geofence> findAllByOrderByCreatedAtDescIdDesc();
}

package com.example.rota.location;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface LocationRepository extends JpaRepository<Location, Long> {
    Optional<Location> findFirstByNameOrderByIdAsc(String name);

    List<Location> findAllByOrderByNameAsc();

    long countByName(String name);
}

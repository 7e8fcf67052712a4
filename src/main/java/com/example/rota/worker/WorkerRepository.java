package com.example.rota.worker;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface WorkerRepository extends JpaRepository<Worker, Long> {
    Optional<Worker> findByEmail(String email);

    List<Worker> findByRoleOrderByNameAsc(Worker.Role role);
}

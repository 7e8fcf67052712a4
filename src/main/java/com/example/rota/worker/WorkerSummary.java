package com.example.rota.worker;

public record WorkerSummary(Long id, String name, String email, String role) {

    public static WorkerSummary from(Worker worker) {
        return new WorkerSummary(
                worker.getId(),
                worker.getName(),
                worker.getEmail(),
                worker.getRole() != null ? worker.getRole().name().toLowerCase() : null
        );
    }
}

package com.example.rota.worker;

import com.example.rota.exception.ResourceNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Transactional(readOnly = true)
public class WorkerService {

    private final WorkerRepository workerRepository;

    public WorkerService(WorkerRepository workerRepository) {
        this.workerRepository = workerRepository;
    }

    public List<WorkerSummary> listWorkers() {
        return workerRepository.findByRoleOrderByNameAsc(Worker.Role.WORKER).stream()
                .map(WorkerSummary::from)
                .toList();
    }

    /**
     * Resolves a worker reference, failing with {@code USER_NOT_FOUND} when it dangles.
     */
    public Worker requireWorker(Long workerId) {
        if (workerId == null) {
            throw ResourceNotFoundException.worker(null);
        }
        return workerRepository.findById(workerId)
                .orElseThrow(() -> ResourceNotFoundException.worker(workerId));
    }
}

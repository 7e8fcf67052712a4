package com.example.rota.worker;

import com.example.rota.common.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/workers")
public class WorkerController {

    private final WorkerService workerService;

    public WorkerController(WorkerService workerService) {
        this.workerService = workerService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<WorkerSummary>>> getWorkers() {
        return ResponseEntity.ok(ApiResponse.success("Workers retrieved", workerService.listWorkers()));
    }
}

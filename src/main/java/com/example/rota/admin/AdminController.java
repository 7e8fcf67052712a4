package com.example.rota.admin;

import com.example.rota.common.ApiResponse;
import com.example.rota.common.error.ErrorLogBuffer;
import com.example.rota.location.LocationRepository;
import com.example.rota.shift.ShiftRepository;
import com.example.rota.shift.ShiftStatus;
import com.example.rota.worker.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operator endpoints: store counts and the recent-failure buffer.
 */
@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private static final Logger logger = LoggerFactory.getLogger(AdminController.class);

    private final WorkerRepository workerRepository;
    private final LocationRepository locationRepository;
    private final ShiftRepository shiftRepository;
    private final ErrorLogBuffer errorLogBuffer;

    public AdminController(WorkerRepository workerRepository,
                           LocationRepository locationRepository,
                           ShiftRepository shiftRepository,
                           ErrorLogBuffer errorLogBuffer) {
        this.workerRepository = workerRepository;
        this.locationRepository = locationRepository;
        this.shiftRepository = shiftRepository;
        this.errorLogBuffer = errorLogBuffer;
    }

    @GetMapping("/status")
    public ResponseEntity<ApiResponse<SystemStatus>> getSystemStatus() {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (ShiftStatus status : ShiftStatus.values()) {
            byStatus.put(status.getLabel(), shiftRepository.countByStatus(status));
        }
        SystemStatus body = new SystemStatus(
                workerRepository.count(),
                locationRepository.count(),
                shiftRepository.count(),
                byStatus
        );
        return ResponseEntity.ok(ApiResponse.success("System status", body));
    }

    @GetMapping("/error-logs")
    public ResponseEntity<ApiResponse<List<ErrorLogBuffer.Entry>>> getErrorLogs(
            @RequestParam(name = "limit", required = false) Integer limit) {
        List<ErrorLogBuffer.Entry> entries = errorLogBuffer.recent(limit);
        return ResponseEntity.ok(ApiResponse.success("Recent error logs", entries,
                Map.of("count", entries.size(), "buffered", errorLogBuffer.size())));
    }

    @DeleteMapping("/error-logs")
    public ResponseEntity<ApiResponse<Void>> clearErrorLogs() {
        errorLogBuffer.clear();
        logger.info("Error log buffer cleared");
        return ResponseEntity.ok(ApiResponse.success("Error logs cleared", null));
    }

    public record SystemStatus(long workers, long locations, long shifts, Map<String, Long> shiftsByStatus) {}
}

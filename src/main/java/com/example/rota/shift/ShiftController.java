package com.example.rota.shift;

import com.example.rota.common.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * HTTP surface of the scheduling engine. The acting worker is identified by the
 * {@value #WORKER_HEADER} header, populated by the authentication gateway in front
 * of this service.
 */
@RestController
@RequestMapping("/api/shifts")
public class ShiftController {

    public static final String WORKER_HEADER = "X-Worker-Id";

    private final ShiftCommandService commandService;
    private final ShiftBatchService batchService;
    private final ShiftQueryService queryService;

    public ShiftController(ShiftCommandService commandService,
                           ShiftBatchService batchService,
                           ShiftQueryService queryService) {
        this.commandService = commandService;
        this.batchService = batchService;
        this.queryService = queryService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<ShiftPage>> getAllShifts(
            @RequestParam(name = "page", required = false) String page,
            @RequestParam(name = "limit", required = false) String limit,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "sortBy", required = false) String sortBy,
            @RequestParam(name = "sortOrder", required = false) String sortOrder) {
        ShiftPageQuery query = ShiftPageQuery.parse(page, limit, status, sortBy, sortOrder);
        return ResponseEntity.ok(ApiResponse.success("Shifts retrieved",
                queryService.findAll(query, Sort.Direction.ASC)));
    }

    @GetMapping("/my-shifts")
    public ResponseEntity<ApiResponse<ShiftPage>> getMyShifts(
            @RequestHeader(WORKER_HEADER) Long workerId,
            @RequestParam(name = "page", required = false) String page,
            @RequestParam(name = "limit", required = false) String limit,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "sortBy", required = false) String sortBy,
            @RequestParam(name = "sortOrder", required = false) String sortOrder) {
        ShiftPageQuery query = ShiftPageQuery.parse(page, limit, status, sortBy, sortOrder);
        return ResponseEntity.ok(ApiResponse.success("Shifts retrieved",
                queryService.findForWorker(workerId, query, Sort.Direction.ASC)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ShiftView>> createShift(@Valid @RequestBody ShiftRequest request) {
        ShiftView created = commandService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success("Shift created", created));
    }

    @PostMapping("/batch")
    public ResponseEntity<ApiResponse<BatchShiftResult>> batchCreateUpdate(@Valid @RequestBody BatchShiftRequest request) {
        BatchShiftResult result = batchService.reconcile(request.shifts());
        Map<String, Object> meta = Map.of(
                "created", result.created().size(),
                "updated", result.updated().size(),
                "failed", result.errors().size()
        );
        return ResponseEntity.ok(ApiResponse.success("Batch processed", result, meta));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<ShiftView>> getShift(@PathVariable Long id) {
        return ResponseEntity.ok(ApiResponse.success("Shift retrieved", queryService.get(id)));
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<ShiftView>> updateShift(@PathVariable Long id,
                                                              @Valid @RequestBody ShiftPatch patch) {
        return ResponseEntity.ok(ApiResponse.success("Shift updated", commandService.update(id, patch)));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<Void>> deleteShift(@PathVariable Long id) {
        commandService.delete(id);
        return ResponseEntity.ok(ApiResponse.success("Shift deleted successfully", null));
    }

    @PatchMapping("/{id}/cancel")
    public ResponseEntity<ApiResponse<Void>> cancelShift(@PathVariable Long id) {
        commandService.cancel(id);
        return ResponseEntity.ok(ApiResponse.success("Shift cancelled successfully", null));
    }

    @PatchMapping("/{id}/clock-in")
    public ResponseEntity<ApiResponse<ClockEventResult>> clockIn(@PathVariable Long id,
                                                                 @RequestHeader(WORKER_HEADER) Long workerId) {
        ClockEventResult result = commandService.clockIn(id, workerId);
        return ResponseEntity.ok(ApiResponse.success(result.message(), result));
    }

    @PatchMapping("/{id}/clock-out")
    public ResponseEntity<ApiResponse<ClockEventResult>> clockOut(@PathVariable Long id,
                                                                  @RequestHeader(WORKER_HEADER) Long workerId) {
        ClockEventResult result = commandService.clockOut(id, workerId);
        return ResponseEntity.ok(ApiResponse.success(result.message(), result));
    }
}

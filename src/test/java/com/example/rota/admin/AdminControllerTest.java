package com.example.rota.admin;

import com.example.rota.common.error.ErrorLogBuffer;
import com.example.rota.location.LocationRepository;
import com.example.rota.shift.ShiftCommandService;
import com.example.rota.shift.ShiftRepository;
import com.example.rota.shift.ShiftView;
import com.example.rota.support.ShiftFixtures;
import com.example.rota.support.TestClockConfig;
import com.example.rota.worker.Worker;
import com.example.rota.worker.WorkerRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfig.class)
class AdminControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ErrorLogBuffer errorLogBuffer;

    @Autowired
    private ShiftCommandService commandService;

    @Autowired
    private ShiftRepository shiftRepository;

    @Autowired
    private LocationRepository locationRepository;

    @Autowired
    private WorkerRepository workerRepository;

    @BeforeEach
    void setUp() {
        shiftRepository.deleteAll();
        locationRepository.deleteAll();
        workerRepository.deleteAll();
        errorLogBuffer.clear();
    }

    @Test
    void status_countsShiftsPerLifecycleState() throws Exception {
        Worker worker = workerRepository.save(new Worker("Alex Carter", "alex@example.com", Worker.Role.WORKER));
        LocalDate date = LocalDate.of(2025, 6, 1);
        commandService.create(ShiftFixtures.request(worker.getId(), date, "09:00", "17:00"));
        ShiftView cancelled = commandService.create(ShiftFixtures.request(worker.getId(), date, "18:00", "22:00"));
        commandService.cancel(cancelled.id());

        mockMvc.perform(get("/api/admin/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.workers").value(1))
            .andExpect(jsonPath("$.data.locations").value(1))
            .andExpect(jsonPath("$.data.shifts").value(2))
            .andExpect(jsonPath("$.data.shiftsByStatus.Scheduled").value(1))
            .andExpect(jsonPath("$.data.shiftsByStatus.Cancelled").value(1))
            .andExpect(jsonPath("$.data.shiftsByStatus['In Progress']").value(0));
    }

    @Test
    void errorLogs_areListedNewestFirstAndCanBeCleared() throws Exception {
        errorLogBuffer.record("GET /api/shifts", new IllegalStateException("first"));
        errorLogBuffer.record("POST /api/shifts", new IllegalStateException("second"));

        mockMvc.perform(get("/api/admin/error-logs").param("limit", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data", hasSize(1)))
            .andExpect(jsonPath("$.data[0].request").value("POST /api/shifts"))
            .andExpect(jsonPath("$.data[0].exception").value("java.lang.IllegalStateException"))
            .andExpect(jsonPath("$.meta.buffered").value(2));

        mockMvc.perform(delete("/api/admin/error-logs"))
            .andExpect(status().isOk());

        assertThat(errorLogBuffer.size()).isZero();
    }

    @Test
    void buffer_dropsTheOldestEntriesBeyondCapacity() {
        ErrorLogBuffer buffer = new ErrorLogBuffer(2);
        buffer.record("a", new RuntimeException("1"));
        buffer.record("b", new RuntimeException("2"));
        buffer.record("c", new RuntimeException("3"));

        assertThat(buffer.recent(null)).extracting(ErrorLogBuffer.Entry::request).containsExactly("c", "b");
    }
}

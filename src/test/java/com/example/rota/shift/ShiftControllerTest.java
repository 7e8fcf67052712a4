package com.example.rota.shift;

import com.example.rota.location.LocationRepository;
import com.example.rota.support.MutableClock;
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
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestClockConfig.class)
class ShiftControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ShiftCommandService commandService;

    @Autowired
    private ShiftRepository shiftRepository;

    @Autowired
    private LocationRepository locationRepository;

    @Autowired
    private WorkerRepository workerRepository;

    @Autowired
    private MutableClock clock;

    // request validation compares dates with the real system clock
    private final LocalDate shiftDate = LocalDate.now().plusDays(30);

    private Worker alex;
    private Worker sam;

    @BeforeEach
    void setUp() {
        shiftRepository.deleteAll();
        locationRepository.deleteAll();
        workerRepository.deleteAll();
        alex = workerRepository.save(new Worker("Alex Carter", "alex@example.com", Worker.Role.WORKER));
        sam = workerRepository.save(new Worker("Sam Patel", "sam@example.com", Worker.Role.WORKER));
        clock.set(shiftDate.atTime(9, 0));
    }

    @Test
    void createShift_returnsCreatedWithDenormalizedView() throws Exception {
        String payload = """
            {
              "title": "Front desk",
              "role": "Receptionist",
              "typeOfShift": ["Weekday", "Night"],
              "user": %d,
              "startTime": "22:00",
              "finishTime": "06:00",
              "location": {
                "name": "MediaCityUK",
                "address": "1 High Street",
                "postCode": "M50 2EQ",
                "cordinates": { "longitude": -2.2965, "latitude": 53.4723 }
              },
              "date": "%s"
            }
            """.formatted(alex.getId(), shiftDate);

        mockMvc.perform(post("/api/shifts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.data.status").value("Scheduled"))
            .andExpect(jsonPath("$.data.startTime").value("22:00"))
            .andExpect(jsonPath("$.data.finishTime").value("06:00"))
            .andExpect(jsonPath("$.data.date").value(shiftDate.toString()))
            .andExpect(jsonPath("$.data.numOfShiftsPerDay").value(1))
            .andExpect(jsonPath("$.data.user.email").value("alex@example.com"))
            .andExpect(jsonPath("$.data.location.postCode").value("M50 2EQ"))
            .andExpect(jsonPath("$.data.location.coordinates.useRotaCloud").value(true));

        Shift saved = shiftRepository.findAll().get(0);
        assertThat(saved.getFinishTime()).isEqualTo(shiftDate.plusDays(1).atTime(6, 0));
    }

    @Test
    void createShift_withInvalidFields_reportsEachOne() throws Exception {
        String payload = """
            {
              "title": " ",
              "role": "Receptionist",
              "typeOfShift": [],
              "user": %d,
              "startTime": "25:00",
              "finishTime": "17:00",
              "numOfShiftsPerDay": 0,
              "location": {
                "name": "MediaCityUK",
                "address": "1 High Street",
                "postCode": "M50 2EQ",
                "cordinates": { "longitude": 200, "latitude": 53.4 }
              },
              "date": "2000-01-01"
            }
            """.formatted(alex.getId());

        mockMvc.perform(post("/api/shifts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details.title").value("Title cannot be empty"))
            .andExpect(jsonPath("$.details.typeOfShift").value("At least one shift type is required"))
            .andExpect(jsonPath("$.details.startTime").value("Time must be in HH:MM format"))
            .andExpect(jsonPath("$.details.numOfShiftsPerDay").exists())
            .andExpect(jsonPath("$.details['location.coordinates.longitude']").exists())
            .andExpect(jsonPath("$.details.date").exists());

        assertThat(shiftRepository.count()).isZero();
    }

    @Test
    void createShift_withUnknownShiftType_isBadRequest() throws Exception {
        String payload = """
            {
              "title": "Front desk",
              "role": "Receptionist",
              "typeOfShift": ["Overtime"],
              "user": %d,
              "startTime": "09:00",
              "finishTime": "17:00",
              "location": {
                "name": "MediaCityUK",
                "address": "1 High Street",
                "postCode": "M50 2EQ",
                "cordinates": { "longitude": -2.2965, "latitude": 53.4723 }
              },
              "date": "%s"
            }
            """.formatted(alex.getId(), shiftDate);

        mockMvc.perform(post("/api/shifts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
    }

    @Test
    void createShift_forUnknownWorker_isNotFound() throws Exception {
        String payload = """
            {
              "title": "Front desk",
              "role": "Receptionist",
              "typeOfShift": ["Weekday"],
              "user": 999999,
              "startTime": "09:00",
              "finishTime": "17:00",
              "location": {
                "name": "MediaCityUK",
                "address": "1 High Street",
                "postCode": "M50 2EQ",
                "coordinates": { "longitude": -2.2965, "latitude": 53.4723 }
              },
              "date": "%s"
            }
            """.formatted(shiftDate);

        mockMvc.perform(post("/api/shifts")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("USER_NOT_FOUND"))
            .andExpect(jsonPath("$.message").value("User not found: 999999"));
    }

    @Test
    void getShift_unknownId_isNotFound() throws Exception {
        mockMvc.perform(get("/api/shifts/424242"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("SHIFT_NOT_FOUND"));
    }

    @Test
    void listShifts_paginatesAndFilters() throws Exception {
        ShiftView first = create(alex, "08:00", "12:00");
        create(alex, "12:00", "16:00");
        ShiftView third = create(sam, "16:00", "20:00");
        commandService.cancel(third.id());

        mockMvc.perform(get("/api/shifts").param("limit", "2").param("page", "2"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.shifts", hasSize(1)))
            .andExpect(jsonPath("$.data.pagination.totalCount").value(3))
            .andExpect(jsonPath("$.data.pagination.totalPages").value(2))
            .andExpect(jsonPath("$.data.pagination.hasNextPage").value(false))
            .andExpect(jsonPath("$.data.pagination.hasPrevPage").value(true));

        mockMvc.perform(get("/api/shifts").param("status", "Cancelled"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.shifts", hasSize(1)))
            .andExpect(jsonPath("$.data.shifts[0].id").value(third.id()));

        mockMvc.perform(get("/api/shifts").param("sortBy", "startTime").param("sortOrder", "asc"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.shifts[0].id").value(first.id()));
    }

    @Test
    void listShifts_withUnsupportedSortField_isBadRequest() throws Exception {
        mockMvc.perform(get("/api/shifts").param("sortBy", "user.password"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        mockMvc.perform(get("/api/shifts").param("limit", "0"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void listShifts_withNonNumericPaging_fallsBackToDefaults() throws Exception {
        create(alex, "08:00", "12:00");

        mockMvc.perform(get("/api/shifts").param("page", "abc").param("limit", "xyz"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.shifts", hasSize(1)))
            .andExpect(jsonPath("$.data.pagination.currentPage").value(1))
            .andExpect(jsonPath("$.data.pagination.limit").value(10));
    }

    @Test
    void listShifts_farBeyondTheLastPage_isEmpty() throws Exception {
        create(alex, "08:00", "12:00");

        mockMvc.perform(get("/api/shifts").param("page", "3000000").param("limit", "1000"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.shifts", hasSize(0)))
            .andExpect(jsonPath("$.data.pagination.totalCount").value(1))
            .andExpect(jsonPath("$.data.pagination.currentPage").value(3000000));
    }

    @Test
    void myShifts_areScopedToTheCallingWorker() throws Exception {
        create(alex, "08:00", "12:00");
        create(sam, "12:00", "16:00");

        mockMvc.perform(get("/api/shifts/my-shifts").header(ShiftController.WORKER_HEADER, sam.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.shifts", hasSize(1)))
            .andExpect(jsonPath("$.data.shifts[0].user.id").value(sam.getId()));

        mockMvc.perform(get("/api/shifts/my-shifts"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void updateShift_appliesPartialChanges_andRefusesAfterCancel() throws Exception {
        ShiftView shift = create(alex, "09:00", "17:00");

        mockMvc.perform(put("/api/shifts/" + shift.id())
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    { "title": "Night porter", "finishTime": "18:00" }
                    """))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.title").value("Night porter"))
            .andExpect(jsonPath("$.data.role").value("Receptionist"))
            .andExpect(jsonPath("$.data.startTime").value("09:00"))
            .andExpect(jsonPath("$.data.finishTime").value("18:00"));

        mockMvc.perform(patch("/api/shifts/" + shift.id() + "/cancel"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Shift cancelled successfully"));

        mockMvc.perform(put("/api/shifts/" + shift.id())
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    { "title": "Too late" }
                    """))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value("INVALID_SHIFT_STATUS"))
            .andExpect(jsonPath("$.message").value("Cannot update shift as it is Cancelled"));

        mockMvc.perform(patch("/api/shifts/" + shift.id() + "/cancel"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value("SHIFT_ALREADY_CANCELLED"));
    }

    @Test
    void deleteShift_removesIt() throws Exception {
        ShiftView shift = create(alex, "09:00", "17:00");

        mockMvc.perform(delete("/api/shifts/" + shift.id()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Shift deleted successfully"));

        assertThat(shiftRepository.existsById(shift.id())).isFalse();
    }

    @Test
    void clockInAndOut_throughTheApi() throws Exception {
        ShiftView shift = create(alex, "09:05", "10:30");

        mockMvc.perform(patch("/api/shifts/" + shift.id() + "/clock-in")
                .header(ShiftController.WORKER_HEADER, sam.getId()))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.errorCode").value("UNAUTHORIZED_SHIFT_ACCESS"));

        mockMvc.perform(patch("/api/shifts/" + shift.id() + "/clock-in")
                .header(ShiftController.WORKER_HEADER, alex.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("Successfully clocked in"))
            .andExpect(jsonPath("$.data.shift.status").value("In Progress"))
            .andExpect(jsonPath("$.data.shift.clockInTime").value("09:00"))
            .andExpect(jsonPath("$.data.shift.clockOutTime").doesNotExist());

        mockMvc.perform(patch("/api/shifts/" + shift.id() + "/clock-out")
                .header(ShiftController.WORKER_HEADER, alex.getId()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.shift.status").value("Completed"))
            .andExpect(jsonPath("$.data.shift.clockOutTime").value("09:00"));

        mockMvc.perform(get("/api/shifts/" + shift.id()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.status").value("Completed"))
            .andExpect(jsonPath("$.data.clockInTime").value("09:00"));
    }

    @Test
    void clockIn_tooEarly_isBadRequestWithReason() throws Exception {
        ShiftView shift = create(alex, "13:00", "17:00");

        mockMvc.perform(patch("/api/shifts/" + shift.id() + "/clock-in")
                .header(ShiftController.WORKER_HEADER, alex.getId()))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("CLOCK_IN_TOO_EARLY"))
            .andExpect(jsonPath("$.message")
                .value("Cannot clock in more than 10 minutes before shift starts (230 minutes too early)"));
    }

    @Test
    void batch_reportsPerItemOutcomes() throws Exception {
        ShiftView existing = create(alex, "09:00", "17:00");
        String location = """
            { "name": "Old Trafford Stadium", "address": "Sir Matt Busby Way", "postCode": "M16 0RA",
              "cordinates": { "longitude": -2.2913, "latitude": 53.4631 } }
            """;
        String payload = """
            {
              "shifts": [
                { "id": %1$d, "title": "Security", "role": "Guard", "typeOfShift": ["Night"], "user": %2$d,
                  "startTime": "20:00", "finishTime": "04:00", "location": %4$s, "date": "%3$s" },
                { "title": "Security", "role": "Guard", "typeOfShift": ["Night"], "user": %2$d,
                  "startTime": "22:00", "finishTime": "06:00", "location": %4$s, "date": "%3$s" },
                { "title": "Security", "role": "Guard", "typeOfShift": ["Night"], "user": 999999,
                  "startTime": "22:00", "finishTime": "06:00", "location": %4$s, "date": "%3$s" }
              ]
            }
            """.formatted(existing.id(), alex.getId(), shiftDate, location);

        mockMvc.perform(post("/api/shifts/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(payload))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.updated", hasSize(1)))
            .andExpect(jsonPath("$.data.created", hasSize(1)))
            .andExpect(jsonPath("$.data.errors", hasSize(1)))
            .andExpect(jsonPath("$.data.errors[0].index").value(2))
            .andExpect(jsonPath("$.data.errors[0].error.errorCode").value("USER_NOT_FOUND"))
            .andExpect(jsonPath("$.data.errors[0].shift.user").value(999999))
            .andExpect(jsonPath("$.meta.created").value(1))
            .andExpect(jsonPath("$.meta.updated").value(1))
            .andExpect(jsonPath("$.meta.failed").value(1));
    }

    @Test
    void batch_withoutItems_isBadRequest() throws Exception {
        mockMvc.perform(post("/api/shifts/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    { "shifts": [] }
                    """))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));
    }

    @Test
    void unsupportedRoutes_keepTheErrorShape() throws Exception {
        mockMvc.perform(post("/api/shifts/1"))
            .andExpect(status().isMethodNotAllowed())
            .andExpect(jsonPath("$.errorCode").value("REQUEST_NOT_SUPPORTED"));

        mockMvc.perform(get("/api/rosters"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("REQUEST_NOT_SUPPORTED"));
    }

    private ShiftView create(Worker worker, String start, String finish) {
        return commandService.create(ShiftFixtures.request(worker.getId(), shiftDate, start, finish));
    }
}

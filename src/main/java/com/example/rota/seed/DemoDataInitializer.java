package com.example.rota.seed;

import com.example.rota.location.LocationPayload;
import com.example.rota.location.LocationRepository;
import com.example.rota.location.LocationService;
import com.example.rota.worker.Worker;
import com.example.rota.worker.WorkerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Loads demo workers and locations when {@code rota.seed.enabled=true}.
 * Workers already present by email are skipped; locations go through
 * find-or-create, so rerunning adds nothing.
 */
@Configuration
@ConditionalOnProperty(name = "rota.seed.enabled", havingValue = "true")
public class DemoDataInitializer {

    private static final Logger logger = LoggerFactory.getLogger(DemoDataInitializer.class);

    @Bean
    CommandLineRunner loadDemoData(WorkerRepository workerRepository,
                                   LocationRepository locationRepository,
                                   LocationService locationService) {
        return args -> {
            int added = 0;
            for (Worker worker : demoWorkers()) {
                if (workerRepository.findByEmail(worker.getEmail()).isEmpty()) {
                    workerRepository.save(worker);
                    added++;
                }
            }
            logger.info("Loaded {} demo workers", added);
            demoLocations().forEach(locationService::findOrCreate);
            logger.info("Demo locations available: {}", locationRepository.count());
        };
    }

    private static List<Worker> demoWorkers() {
        return List.of(
                new Worker("Admin", "admin@example.com", Worker.Role.ADMIN),
                new Worker("Alex Carter", "alex.carter@example.com", Worker.Role.WORKER),
                new Worker("Sam Patel", "sam.patel@example.com", Worker.Role.WORKER),
                new Worker("Jordan Lee", "jordan.lee@example.com", Worker.Role.WORKER)
        );
    }

    private static List<LocationPayload> demoLocations() {
        return List.of(
                location("The Willow", "Reigate, Surrey", "RH2 7EN", -0.181425, 51.231602),
                location("Clippers House, Clippers Quay", "Salford Quays, Salford", "M50 3XP", -2.286226, 53.466921),
                location("Old Trafford Stadium", "Sir Matt Busby Way, Trafford", "M16 0RA", -2.291032, 53.462559),
                location("MediaCityUK", "Salford Quays, Salford", "M50 3UQ", -2.2994, 53.4721),
                location("Manchester Piccadilly Station", "Piccadilly, Manchester", "M1 2AP", -2.2309, 53.4774)
        );
    }

    private static LocationPayload location(String name, String address, String postCode, double lon, double lat) {
        return new LocationPayload(name, address, postCode, new LocationPayload.CoordinatesPayload(lon, lat));
    }
}

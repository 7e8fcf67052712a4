package com.example.rota.location;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@Transactional
public class LocationService {

    private static final Logger logger = LoggerFactory.getLogger(LocationService.class);

    private final LocationRepository locationRepository;

    public LocationService(LocationRepository locationRepository) {
        this.locationRepository = locationRepository;
    }

    /**
     * Returns the location with the payload's name, creating it on first reference.
     * <p>
     * An existing record is returned as stored: address and coordinates in the
     * payload are ignored. Lookup and insert are two separate statements, so two
     * concurrent callers may both insert the same name; a unique index on
     * {@code name} with fetch-on-conflict is required to rule that out.
     */
    public Location findOrCreate(LocationPayload payload) {
        String name = payload.name().trim();
        Optional<Location> existing = locationRepository.findFirstByNameOrderByIdAsc(name);
        if (existing.isPresent()) {
            return existing.get();
        }
        Location saved = locationRepository.save(payload.toLocation());
        logger.info("Created location: ID={}, name={}", saved.getId(), saved.getName());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<LocationSummary> listLocations() {
        return locationRepository.findAllByOrderByNameAsc().stream()
                .map(LocationSummary::from)
                .toList();
    }
}

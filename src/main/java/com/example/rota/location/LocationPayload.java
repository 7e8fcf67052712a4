package com.example.rota.location;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Location as submitted with a shift. The misspelt {@code cordinates} key is the
 * wire name existing clients send.
 */
public record LocationPayload(
        @NotBlank(message = "Location name cannot be empty") String name,
        @NotBlank(message = "Location address cannot be empty") String address,
        @NotBlank(message = "Location post code cannot be empty") String postCode,
        @JsonProperty("cordinates") @JsonAlias("coordinates")
        @NotNull(message = "Location coordinates are required") @Valid CoordinatesPayload coordinates
) {

    public record CoordinatesPayload(
            @NotNull(message = "Longitude must be a number")
            @DecimalMin(value = "-180", message = "Longitude must be between -180 and 180")
            @DecimalMax(value = "180", message = "Longitude must be between -180 and 180")
            Double longitude,
            @NotNull(message = "Latitude must be a number")
            @DecimalMin(value = "-90", message = "Latitude must be between -90 and 90")
            @DecimalMax(value = "90", message = "Latitude must be between -90 and 90")
            Double latitude
    ) {}

    Location toLocation() {
        Coordinates coords = coordinates == null
                ? null
                : new Coordinates(coordinates.longitude(), coordinates.latitude(), true);
        return new Location(name.trim(), address == null ? null : address.trim(),
                postCode == null ? null : postCode.trim(), coords);
    }
}

package com.example.rota.location;

public record LocationSummary(
        Long id,
        String name,
        String postCode,
        Double distance,
        String constituency,
        String adminDistrict,
        CoordinatesView coordinates,
        String address
) {

    public record CoordinatesView(Double longitude, Double latitude, Boolean useRotaCloud) {}

    public static LocationSummary from(Location location) {
        Coordinates c = location.getCoordinates();
        return new LocationSummary(
                location.getId(),
                location.getName(),
                location.getPostCode(),
                location.getDistance(),
                location.getConstituency(),
                location.getAdminDistrict(),
                c != null ? new CoordinatesView(c.getLongitude(), c.getLatitude(), c.getUseRotaCloud()) : null,
                location.getAddress()
        );
    }
}

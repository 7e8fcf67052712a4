package com.example.rota.location;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class Coordinates {

    @Column(nullable = false)
    private Double longitude;

    @Column(nullable = false)
    private Double latitude;

    @Column(name = "use_rota_cloud")
    private Boolean useRotaCloud = true;

    protected Coordinates() {
    }

    public Coordinates(Double longitude, Double latitude, Boolean useRotaCloud) {
        this.longitude = longitude;
        this.latitude = latitude;
        this.useRotaCloud = useRotaCloud == null ? Boolean.TRUE : useRotaCloud;
    }

    public Double getLongitude() { return longitude; }
    public Double getLatitude() { return latitude; }
    public Boolean getUseRotaCloud() { return useRotaCloud; }
}

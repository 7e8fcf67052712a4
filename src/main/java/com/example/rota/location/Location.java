package com.example.rota.location;

import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "locations", indexes = @Index(name = "idx_locations_name", columnList = "name"))
public class Location {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column
    private String address;

    @Column(name = "post_code", length = 16)
    private String postCode;

    @Column
    private Double distance = 0d;

    @Column
    private String constituency;

    @Column(name = "admin_district")
    private String adminDistrict;

    @Embedded
    private Coordinates coordinates;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    protected Location() {
    }

    public Location(String name, String address, String postCode, Coordinates coordinates) {
        this.name = name;
        this.address = address;
        this.postCode = postCode;
        this.coordinates = coordinates;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getAddress() {
        return address;
    }

    public String getPostCode() {
        return postCode;
    }

    public Double getDistance() {
        return distance;
    }

    public String getConstituency() {
        return constituency;
    }

    public String getAdminDistrict() {
        return adminDistrict;
    }

    public Coordinates getCoordinates() {
        return coordinates;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }
}

package com.example.rota.worker;

import jakarta.persistence.*;

import java.time.LocalDateTime;

/**
 * Person a shift can be assigned to. Credentials live with the authentication
 * service; only identity, name, email and role are kept here.
 */
@Entity
@Table(name = "workers")
public class Worker {

    public enum Role {
        WORKER,
        ADMIN
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, unique = true)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Role role = Role.WORKER;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    protected Worker() {
    }

    public Worker(String name, String email, Role role) {
        this.name = name;
        this.email = email;
        this.role = role;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getEmail() {
        return email;
    }

    public Role getRole() {
        return role;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }
}

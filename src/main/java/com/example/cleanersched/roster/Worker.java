package com.example.cleanersched.roster;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;

@Entity
@Table(name = "workers")
public class Worker {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    @NotBlank(message = "清掃員名は必須です")
    @Size(min = 1, max = 50, message = "清掃員名は1文字以上50文字以下で入力してください")
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "security_clearance", length = 16)
    private Clearance clearance = Clearance.LOW;

    @Column(name = "active")
    private Boolean active = true;

    @Column(name = "created_at")
    private LocalDateTime createdAt;

    protected Worker() {
    }

    public Worker(String name, Clearance clearance) {
        this(name, clearance, true);
    }

    public Worker(String name, Clearance clearance, boolean active) {
        this.name = name;
        this.clearance = clearance;
        this.active = active;
        this.createdAt = LocalDateTime.now();
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

    public void setId(Long id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Clearance getClearance() {
        return clearance;
    }

    public void setClearance(Clearance clearance) {
        this.clearance = clearance;
    }

    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }

    public LocalDateTime getCreatedAt() { return createdAt; }

    // クリアランス未設定は LOW 扱い
    @JsonIgnore
    public Clearance effectiveClearance() {
        return Clearance.orLow(clearance);
    }

    @JsonIgnore
    public boolean isAvailableForWork() {
        return Boolean.TRUE.equals(active);
    }
}

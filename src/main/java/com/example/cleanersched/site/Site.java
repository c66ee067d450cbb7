package com.example.cleanersched.site;

import com.example.cleanersched.roster.Clearance;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;

/**
 * 顧客の清掃現場。(顧客名, 現場名) の組で一意。
 * <p>
 * {@code requiredClearance} が null の現場はクリアランス判定の対象外。
 */
@Entity
@Table(name = "sites",
        uniqueConstraints = @UniqueConstraint(columnNames = {"client_name", "site_name"}))
public class Site {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "client_name", nullable = false)
    @NotBlank(message = "顧客名は必須です")
    private String clientName;

    @Column(name = "site_name", nullable = false)
    @NotBlank(message = "現場名は必須です")
    private String siteName;

    @Enumerated(EnumType.STRING)
    @Column(name = "required_clearance", length = 16)
    private Clearance requiredClearance;

    @Column(name = "address")
    private String address;

    protected Site() {
    }

    public Site(String clientName, String siteName, Clearance requiredClearance) {
        this.clientName = clientName;
        this.siteName = siteName;
        this.requiredClearance = requiredClearance;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getClientName() { return clientName; }
    public void setClientName(String clientName) { this.clientName = clientName; }

    public String getSiteName() { return siteName; }
    public void setSiteName(String siteName) { this.siteName = siteName; }

    public Clearance getRequiredClearance() { return requiredClearance; }
    public void setRequiredClearance(Clearance requiredClearance) { this.requiredClearance = requiredClearance; }

    public String getAddress() { return address; }
    public void setAddress(String address) { this.address = address; }
}

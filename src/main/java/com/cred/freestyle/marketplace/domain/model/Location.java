package com.cred.freestyle.marketplace.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Where an ad's item is located.
 *
 * @author Marketplace Team
 */
@Entity
@Table(name = "locations", indexes = {
    @Index(name = "idx_locations_city", columnList = "city"),
    @Index(name = "idx_locations_county", columnList = "county")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Location {

    @Id
    @Column(name = "location_id", nullable = false, length = 36)
    private String locationId;

    @Column(name = "city", nullable = false, length = 100)
    private String city;

    @Column(name = "county", length = 100)
    private String county;

    @Column(name = "country", nullable = false, length = 100)
    @Builder.Default
    private String country = "Kenya";

    @PrePersist
    protected void onCreate() {
        if (locationId == null) {
            locationId = UUID.randomUUID().toString();
        }
    }
}

package com.flagship.medexchange_ledger.workflow;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * City an exchange happens in. Exchanges and their deliveries never leave it.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(staticName = "of")
public class Location {

    @Column(name = "city_id", nullable = false)
    private String cityId;

    @Column(name = "country_code", nullable = false, length = 2)
    private String countryCode;
}

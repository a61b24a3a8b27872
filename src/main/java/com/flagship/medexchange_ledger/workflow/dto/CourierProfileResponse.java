package com.flagship.medexchange_ledger.workflow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.medexchange_ledger.workflow.CourierProfileEntity;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class CourierProfileResponse {

    @JsonProperty("courier_id")
    String courierId;

    @JsonProperty("country_code")
    String countryCode;

    @JsonProperty("city_ids")
    List<String> cityIds;

    @JsonProperty("active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;

    public static CourierProfileResponse from(CourierProfileEntity entity) {
        return CourierProfileResponse.builder()
                .courierId(entity.getCourierId())
                .countryCode(entity.getCountryCode())
                .cityIds(entity.getServiceCities().stream().sorted().toList())
                .active(entity.isActive())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}

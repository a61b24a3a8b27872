package com.flagship.medexchange_ledger.workflow;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Answers whether an active courier serves a city. Plain JDBC so the write
 * policy can ask while Hibernate is flushing.
 */
@Component
@RequiredArgsConstructor
public class CourierServiceArea {

    private static final String SERVES_CITY = """
            SELECT EXISTS (
                SELECT 1 FROM courier_profiles p
                JOIN courier_service_cities c ON c.courier_id = p.courier_id
                WHERE p.courier_id = ? AND p.active AND c.city_id = ?
            )
            """;

    private final JdbcTemplate jdbcTemplate;

    public boolean serves(String courierId, String cityId) {
        if (courierId == null || cityId == null) {
            return false;
        }
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(SERVES_CITY, Boolean.class, courierId, cityId));
    }
}

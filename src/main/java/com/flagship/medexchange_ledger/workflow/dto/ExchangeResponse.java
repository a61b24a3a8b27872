package com.flagship.medexchange_ledger.workflow.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.medexchange_ledger.workflow.ExchangeEntity;
import com.flagship.medexchange_ledger.workflow.ExchangeItem;
import com.flagship.medexchange_ledger.workflow.ExchangeStatus;
import com.flagship.medexchange_ledger.workflow.ItemSide;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class ExchangeResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("requester_id")
    String requesterId;

    @JsonProperty("responder_id")
    String responderId;

    @JsonProperty("status")
    ExchangeStatus status;

    @JsonProperty("city_id")
    String cityId;

    @JsonProperty("country_code")
    String countryCode;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("requested_items")
    List<Item> requestedItems;

    @JsonProperty("offered_items")
    List<Item> offeredItems;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ExchangeResponse from(ExchangeEntity entity) {
        return ExchangeResponse.builder()
                .id(entity.getId())
                .requesterId(entity.getRequesterId())
                .responderId(entity.getResponderId())
                .status(entity.getStatus())
                .cityId(entity.getLocation().getCityId())
                .countryCode(entity.getLocation().getCountryCode())
                .notes(entity.getNotes())
                .requestedItems(items(entity, ItemSide.REQUESTED))
                .offeredItems(items(entity, ItemSide.OFFERED))
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }

    private static List<Item> items(ExchangeEntity entity, ItemSide side) {
        return entity.getItems().stream()
                .filter(item -> item.getSide() == side)
                .map(Item::from)
                .toList();
    }

    @Value
    public static class Item {

        @JsonProperty("medicine_id")
        String medicineId;

        @JsonProperty("name")
        String name;

        @JsonProperty("quantity")
        int quantity;

        static Item from(ExchangeItem item) {
            return new Item(item.getMedicineId(), item.getMedicineName(), item.getQuantity());
        }
    }
}

package com.freeeemulator.api.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class DealDetailRequest {

    @NotNull(message = "Missing account_item_id")
    private Long accountItemId;

    private int taxCode;

    @NotNull(message = "Missing amount")
    private Long amount;

    private String description;
}

package com.freeeemulator.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
public class JournalDetailRequest {

    @NotBlank(message = "Missing entry_type")
    @Pattern(regexp = "debit|credit", message = "Invalid entry_type")
    private String entryType;

    @NotNull(message = "Missing account_item_id")
    private Long accountItemId;

    private int taxCode;

    private Long partnerId;

    @NotNull(message = "Missing amount")
    private Long amount;

    private long vat;

    private String description;
}

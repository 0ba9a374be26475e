package com.freeeemulator.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

/**
 * Partial update: only the fields present are applied.
 * Details, when given, replace every existing detail.
 */
@Data
public class UpdateDealRequest {

    private LocalDate issueDate;

    private LocalDate dueDate;

    private String refNumber;

    private Long partnerId;

    private List<@NotNull(message = "Invalid details") @Valid DealDetailRequest> details;
}

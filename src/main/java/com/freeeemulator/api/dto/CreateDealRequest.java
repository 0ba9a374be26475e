package com.freeeemulator.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

@Data
public class CreateDealRequest {

    @NotNull(message = "Missing company_id")
    @Positive(message = "Invalid company_id")
    private Long companyId;

    @NotNull(message = "Missing issue_date")
    private LocalDate issueDate;

    private LocalDate dueDate;

    @NotBlank(message = "Missing type")
    @Pattern(regexp = "income|expense", message = "Invalid type")
    private String type;

    @NotEmpty(message = "Missing details")
    private List<@NotNull(message = "Invalid details") @Valid DealDetailRequest> details;

    private List<@NotNull(message = "Invalid payments") @Valid DealPaymentRequest> payments;

    private String refNumber;

    private Long partnerId;
}

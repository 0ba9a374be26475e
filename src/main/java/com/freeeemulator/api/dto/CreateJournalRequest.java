package com.freeeemulator.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

@Data
public class CreateJournalRequest {

    @NotNull(message = "Missing company_id")
    @Positive(message = "Invalid company_id")
    private Long companyId;

    @NotNull(message = "Missing issue_date")
    private LocalDate issueDate;

    @NotEmpty(message = "Missing details")
    private List<@NotNull(message = "Invalid details") @Valid JournalDetailRequest> details;
}

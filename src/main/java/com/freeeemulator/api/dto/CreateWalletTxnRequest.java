package com.freeeemulator.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Data;

import java.time.LocalDate;

@Data
public class CreateWalletTxnRequest {

    @NotNull(message = "Missing company_id")
    @Positive(message = "Invalid company_id")
    private Long companyId;

    @NotNull(message = "Missing date")
    private LocalDate date;

    @NotNull(message = "Missing amount")
    private Long amount;

    /**
     * Derived from the sign of the amount when omitted.
     */
    @Pattern(regexp = "income|expense", message = "Invalid entry_side")
    private String entrySide;

    @NotBlank(message = "Missing walletable_type")
    @Pattern(regexp = "bank_account|credit_card|wallet", message = "Invalid walletable_type")
    private String walletableType;

    @NotNull(message = "Missing walletable_id")
    private Long walletableId;

    private String description;
}

package com.freeeemulator.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.time.LocalDate;

@Data
public class DealPaymentRequest {

    @NotNull(message = "Missing payment date")
    private LocalDate date;

    @NotNull(message = "Missing payment amount")
    private Long amount;

    @Pattern(regexp = "bank_account|credit_card|wallet", message = "Invalid from_walletable_type")
    private String fromWalletableType;

    private Long fromWalletableId;
}

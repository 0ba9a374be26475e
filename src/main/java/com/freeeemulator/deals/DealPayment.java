package com.freeeemulator.deals;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.freeeemulator.walletables.WalletableType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A payment made against a deal, optionally naming the walletable it came from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DealPayment {

    private long id;
    private LocalDate date;
    private long amount;
    private WalletableType fromWalletableType;
    private Long fromWalletableId;

    @JsonIgnore
    public boolean namesWalletable() {
        return fromWalletableType != null && fromWalletableId != null;
    }
}

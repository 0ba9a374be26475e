package com.freeeemulator.wallettxns;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.freeeemulator.common.exception.InvalidParameterException;
import com.freeeemulator.walletables.WalletableType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A single line of a bank or card statement (明細).
 *
 * Starts unbooked and becomes settled once a deal accounts for it, either
 * through settlement or a direct update. A settled transaction never goes
 * back to unbooked.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WalletTxn {

    private long id;
    private long companyId;
    private LocalDate date;

    /**
     * Signed amount: negative for money leaving the walletable.
     */
    private long amount;

    private EntrySide entrySide;
    private WalletableType walletableType;
    private long walletableId;
    private String description;
    private WalletTxnStatus status;
    private Long dealId;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Link this transaction to a deal.
     */
    public void settle(long dealId, Instant at) {
        changeStatus(WalletTxnStatus.SETTLED, at);
        this.dealId = dealId;
    }

    public void changeStatus(WalletTxnStatus target, Instant at) {
        if (status == WalletTxnStatus.SETTLED && target == WalletTxnStatus.UNBOOKED) {
            throw new InvalidParameterException(
                "Wallet transaction " + id + " is settled and cannot return to unbooked");
        }
        this.status = target;
        this.updatedAt = at;
    }

    @JsonIgnore
    public boolean isUnbooked() {
        return status == WalletTxnStatus.UNBOOKED;
    }

    @JsonIgnore
    public long getAbsoluteAmount() {
        return Math.abs(amount);
    }
}

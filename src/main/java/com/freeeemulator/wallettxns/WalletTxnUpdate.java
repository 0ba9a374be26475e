package com.freeeemulator.wallettxns;

import lombok.Builder;
import lombok.Data;

/**
 * Fields of a partial wallet transaction update; null means unchanged.
 */
@Data
@Builder
public class WalletTxnUpdate {

    private WalletTxnStatus status;
    private Long dealId;
    private String description;
}

package com.freeeemulator.settlement;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Wallet transactions settled by one deal.
 */
@Data
@AllArgsConstructor
public class SettlementResult {

    private long dealId;
    private List<Long> settledWalletTxnIds;
}

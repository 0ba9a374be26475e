package com.freeeemulator.walletables;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A bank account, credit card or cash wallet.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Walletable {

    private long id;
    private String name;
    private WalletableType type;

    /** Only set for bank accounts. */
    private Long bankId;

    private long lastBalance;
    private long walletableBalance;
}

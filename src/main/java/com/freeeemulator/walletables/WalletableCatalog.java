package com.freeeemulator.walletables;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Seeded, read-only set of walletables shared by every company.
 */
@Component
public class WalletableCatalog {

    private final List<Walletable> walletables = List.of(
        new Walletable(1, "GMOあおぞらネット銀行", WalletableType.BANK_ACCOUNT, 1L, 1_000_000, 1_000_000),
        new Walletable(2, "アメリカン・エキスプレス", WalletableType.CREDIT_CARD, null, -50_000, -50_000),
        new Walletable(3, "三井住友カード", WalletableType.CREDIT_CARD, null, -30_000, -30_000),
        new Walletable(4, "現金", WalletableType.WALLET, null, 50_000, 50_000)
    );

    public List<Walletable> findAll() {
        return walletables;
    }

    /**
     * Walletables whose type code equals the filter. An unknown code matches nothing.
     */
    public List<Walletable> findByTypeCode(String typeCode) {
        return walletables.stream()
            .filter(walletable -> walletable.getType().getCode().equals(typeCode))
            .collect(Collectors.toList());
    }
}

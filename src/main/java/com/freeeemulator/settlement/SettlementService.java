package com.freeeemulator.settlement;

import com.freeeemulator.deals.Deal;
import com.freeeemulator.deals.DealPayment;
import com.freeeemulator.storage.StorageCollections;
import com.freeeemulator.storage.StorageEngine;
import com.freeeemulator.wallettxns.WalletTxn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Service for settling unbooked wallet transactions against new deals.
 *
 * Settlement flow, once per payment line:
 * 1. Find unbooked wallet transactions of the deal's company with the
 *    payment's date and absolute amount (and walletable, when named)
 * 2. Pick one candidate; ambiguous matches follow the configured policy
 * 3. Lock the candidate and re-check it is still unbooked
 * 4. Mark it settled and link it to the deal
 *
 * A payment without a match leaves every transaction untouched and never
 * fails the deal.
 */
@Service
@Slf4j
public class SettlementService {

    private final StorageEngine storage;
    private final Clock clock;
    private final AmbiguousMatchPolicy ambiguousMatchPolicy;
    private final boolean autoMatchWithoutPayments;

    public SettlementService(
            StorageEngine storage,
            Clock clock,
            @Value("${freee-emulator.settlement.ambiguous-match:SKIP}") AmbiguousMatchPolicy ambiguousMatchPolicy,
            @Value("${freee-emulator.settlement.auto-match-without-payments:false}") boolean autoMatchWithoutPayments) {
        this.storage = storage;
        this.clock = clock;
        this.ambiguousMatchPolicy = ambiguousMatchPolicy;
        this.autoMatchWithoutPayments = autoMatchWithoutPayments;
    }

    /**
     * Settle the wallet transactions paid by a stored deal.
     * Joins the deal-creation transaction.
     */
    @Transactional
    public SettlementResult settle(Deal deal) {
        List<Long> settled = new ArrayList<>();

        if (deal.getPayments() != null && !deal.getPayments().isEmpty()) {
            for (DealPayment payment : deal.getPayments()) {
                settleOne(deal, matching(deal, payment), "payment " + payment.getId())
                    .ifPresent(settled::add);
            }
        } else if (autoMatchWithoutPayments) {
            Predicate<WalletTxn> sameDayAndAmount = txn ->
                txn.getCompanyId() == deal.getCompanyId()
                    && deal.getIssueDate().equals(txn.getDate())
                    && txn.getAbsoluteAmount() == Math.abs(deal.getAmount());
            settleOne(deal, sameDayAndAmount, "deal amount").ifPresent(settled::add);
        }

        return new SettlementResult(deal.getId(), settled);
    }

    private Predicate<WalletTxn> matching(Deal deal, DealPayment payment) {
        Predicate<WalletTxn> criteria = txn ->
            txn.getCompanyId() == deal.getCompanyId()
                && payment.getDate() != null
                && payment.getDate().equals(txn.getDate())
                && txn.getAbsoluteAmount() == Math.abs(payment.getAmount());

        if (payment.namesWalletable()) {
            criteria = criteria.and(txn ->
                txn.getWalletableType() == payment.getFromWalletableType()
                    && txn.getWalletableId() == payment.getFromWalletableId());
        }
        return criteria;
    }

    private Optional<Long> settleOne(Deal deal, Predicate<WalletTxn> criteria, String source) {
        List<WalletTxn> candidates = storage.scan(StorageCollections.WALLET_TXNS, WalletTxn.class,
            txn -> txn.isUnbooked() && criteria.test(txn));

        if (candidates.isEmpty()) {
            log.debug("No unbooked wallet transaction matches {} of deal {}", source, deal.getId());
            return Optional.empty();
        }

        if (candidates.size() > 1 && ambiguousMatchPolicy == AmbiguousMatchPolicy.SKIP) {
            log.info("{} unbooked wallet transactions match {} of deal {}, leaving them unbooked",
                candidates.size(), source, deal.getId());
            return Optional.empty();
        }

        // Candidates come back in id order
        long walletTxnId = candidates.get(0).getId();

        Optional<WalletTxn> locked = storage.getForUpdate(
            StorageCollections.WALLET_TXNS, walletTxnId, WalletTxn.class);
        if (locked.isEmpty() || !locked.get().isUnbooked()) {
            log.info("Wallet transaction {} was settled or removed concurrently, skipping {} of deal {}",
                walletTxnId, source, deal.getId());
            return Optional.empty();
        }

        WalletTxn txn = locked.get();
        txn.settle(deal.getId(), clock.instant());
        storage.put(StorageCollections.WALLET_TXNS, walletTxnId, txn);

        log.info("Settled wallet transaction {} with deal {} ({})", walletTxnId, deal.getId(), source);
        return Optional.of(walletTxnId);
    }
}

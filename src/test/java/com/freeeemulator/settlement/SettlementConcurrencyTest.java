package com.freeeemulator.settlement;

import com.freeeemulator.deals.Deal;
import com.freeeemulator.deals.DealDetail;
import com.freeeemulator.deals.DealPayment;
import com.freeeemulator.deals.DealService;
import com.freeeemulator.deals.DealType;
import com.freeeemulator.walletables.WalletableType;
import com.freeeemulator.wallettxns.WalletTxn;
import com.freeeemulator.wallettxns.WalletTxnService;
import com.freeeemulator.wallettxns.WalletTxnStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent deals competing for the same wallet transaction.
 * Not transactional: each worker commits its own transaction.
 */
@SpringBootTest
@ActiveProfiles("test")
class SettlementConcurrencyTest {

    private static final LocalDate DATE = LocalDate.of(2024, 11, 20);

    @Autowired
    private SettlementService settlementService;

    @Autowired
    private DealService dealService;

    @Autowired
    private WalletTxnService walletTxnService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Test
    void testConcurrentSettlementsSettleOnce() throws Exception {
        long companyId = 8401;
        WalletTxn txn = createTxn(companyId);
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);

        int workers = 4;
        ExecutorService executor = Executors.newFixedThreadPool(workers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<SettlementResult>> results = new ArrayList<>();
        try {
            for (int i = 0; i < workers; i++) {
                long dealId = 900_000 + i;
                Callable<SettlementResult> worker = () -> {
                    start.await();
                    return transaction.execute(status -> settlementService.settle(paidDeal(companyId, dealId)));
                };
                results.add(executor.submit(worker));
            }
            start.countDown();

            int settledCount = 0;
            for (Future<SettlementResult> result : results) {
                settledCount += result.get(30, TimeUnit.SECONDS).getSettledWalletTxnIds().size();
            }
            assertEquals(1, settledCount);
        } finally {
            executor.shutdownNow();
        }

        WalletTxn after = walletTxnService.getWalletTxn(txn.getId());
        assertEquals(WalletTxnStatus.SETTLED, after.getStatus());
        assertTrue(after.getDealId() >= 900_000 && after.getDealId() < 900_000 + workers);
    }

    @Test
    void testConcurrentDealCreationSettlesOnce() throws Exception {
        long companyId = 8402;
        WalletTxn txn = createTxn(companyId);

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Callable<Deal> create = () -> {
                start.await();
                return dealService.createDeal(paidDeal(companyId, 0));
            };
            Future<Deal> first = executor.submit(create);
            Future<Deal> second = executor.submit(create);
            start.countDown();

            long firstId = first.get(30, TimeUnit.SECONDS).getId();
            long secondId = second.get(30, TimeUnit.SECONDS).getId();

            WalletTxn after = walletTxnService.getWalletTxn(txn.getId());
            assertEquals(WalletTxnStatus.SETTLED, after.getStatus());
            assertTrue(after.getDealId() == firstId || after.getDealId() == secondId);
            assertEquals(2, dealService.listDeals(companyId).size());
        } finally {
            executor.shutdownNow();
        }
    }

    private WalletTxn createTxn(long companyId) {
        return walletTxnService.createWalletTxn(WalletTxn.builder()
            .companyId(companyId)
            .date(DATE)
            .amount(-1980)
            .walletableType(WalletableType.CREDIT_CARD)
            .walletableId(2)
            .build());
    }

    private static Deal paidDeal(long companyId, long dealId) {
        return Deal.builder()
            .id(dealId)
            .companyId(companyId)
            .issueDate(DATE)
            .type(DealType.EXPENSE)
            .details(List.of(DealDetail.builder().accountItemId(504).taxCode(136).amount(1800).build()))
            .payments(List.of(DealPayment.builder()
                .date(DATE)
                .amount(1980)
                .fromWalletableType(WalletableType.CREDIT_CARD)
                .fromWalletableId(2L)
                .build()))
            .amount(1980)
            .build();
    }
}

package com.freeeemulator.receipts;

import com.freeeemulator.common.exception.RecordNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for receipt uploads against a temporary upload directory.
 * Not transactional: the file is moved into place only when the record commits.
 * Each test uses its own company.
 */
@SpringBootTest
@ActiveProfiles("test")
class ReceiptServiceTest {

    private static final byte[] PDF = "%PDF-1.4 test receipt".getBytes(StandardCharsets.UTF_8);

    @Autowired
    private ReceiptService receiptService;

    @Autowired
    private ReceiptFileStore fileStore;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Test
    void testCreate_StoresFileUnderReceiptId() throws IOException {
        Receipt receipt = upload(8601, "amazon-order.pdf");

        Path expected = fileStore.getUploadRoot().resolve("8601").resolve(receipt.getId() + ".pdf");
        assertEquals(expected.toString(), receipt.getFilePath());
        assertArrayEquals(PDF, Files.readAllBytes(expected));
        assertEquals(ReceiptStatus.UNCONFIRMED, receipt.getStatus());
        assertEquals("amazon-order.pdf", receipt.getFileName());
    }

    @Test
    void testCreate_LeavesNoTemporaryFile() throws IOException {
        upload(8602, "receipt.pdf");

        try (Stream<Path> files = Files.list(fileStore.getUploadRoot().resolve("8602"))) {
            assertTrue(files.noneMatch(file -> file.getFileName().toString().startsWith("temp_")));
        }
    }

    @Test
    void testCreateThenGet() {
        Receipt created = upload(8603, "receipt.pdf");

        Receipt loaded = receiptService.getReceipt(created.getId());

        assertEquals(created.getFilePath(), loaded.getFilePath());
        assertEquals(LocalDate.of(2024, 11, 20), loaded.getIssueDate());
        assertEquals(1, receiptService.listReceipts(8603L).size());
    }

    @Test
    void testDelete_RemovesRecordAndFile() {
        Receipt receipt = upload(8604, "receipt.pdf");

        receiptService.deleteReceipt(receipt.getId());

        assertThrows(RecordNotFoundException.class, () -> receiptService.getReceipt(receipt.getId()));
        assertFalse(Files.exists(Paths.get(receipt.getFilePath())));
    }

    @Test
    void testDelete_FileAlreadyGone() throws IOException {
        Receipt receipt = upload(8605, "receipt.pdf");
        Files.delete(Paths.get(receipt.getFilePath()));

        receiptService.deleteReceipt(receipt.getId());

        assertThrows(RecordNotFoundException.class, () -> receiptService.getReceipt(receipt.getId()));
    }

    @Test
    void testCreate_RolledBackLeavesNoFile() throws IOException {
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);

        Receipt receipt = transaction.execute(status -> {
            Receipt created = upload(8606, "receipt.pdf");
            status.setRollbackOnly();
            return created;
        });

        assertNotNull(receipt);
        assertFalse(Files.exists(Paths.get(receipt.getFilePath())));
        assertThrows(RecordNotFoundException.class, () -> receiptService.getReceipt(receipt.getId()));
        try (Stream<Path> files = Files.list(fileStore.getUploadRoot().resolve("8606"))) {
            assertEquals(0, files.count());
        }
    }

    @Test
    void testDelete_MissingId() {
        assertThrows(RecordNotFoundException.class, () -> receiptService.deleteReceipt(Long.MAX_VALUE));
    }

    private Receipt upload(long companyId, String fileName) {
        return receiptService.createReceipt(companyId, LocalDate.of(2024, 11, 20), "Amazon order",
            fileName, new ByteArrayInputStream(PDF));
    }
}

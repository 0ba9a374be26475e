package com.freeeemulator.receipts;

import com.freeeemulator.common.exception.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

/**
 * Receipt files on disk, one directory per company.
 *
 * Uploads are written under a temporary name first and moved to
 * {@code <receiptId>.pdf} once the receipt record exists.
 */
@Component
@Slf4j
public class ReceiptFileStore {

    private static final String TEMP_PREFIX = "temp_";

    private final Path uploadRoot;

    public ReceiptFileStore(@Value("${freee-emulator.receipts.upload-dir:./data/receipts}") String uploadDir) {
        this.uploadRoot = Paths.get(uploadDir).toAbsolutePath().normalize();
    }

    public Path saveTemporary(long companyId, String originalFileName, InputStream content) {
        Path companyDir = companyDirectory(companyId);
        Path target = companyDir.resolve(TEMP_PREFIX + UUID.randomUUID() + "_" + safeName(originalFileName));
        try {
            Files.createDirectories(companyDir);
            Files.copy(content, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            discard(target);
            throw new StorageException("Failed to save uploaded receipt file", e);
        }
        return target;
    }

    /**
     * Move a temporary upload to its final name.
     */
    public Path promote(Path temporary, long companyId, long receiptId) {
        Path target = pathFor(companyId, receiptId);
        try {
            return Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new StorageException("Failed to rename receipt file for receipt " + receiptId, e);
        }
    }

    /**
     * Best-effort removal.
     *
     * @return false if the file could not be removed
     */
    public boolean discard(Path file) {
        if (file == null) {
            return true;
        }
        try {
            Files.deleteIfExists(file);
            return true;
        } catch (IOException e) {
            log.warn("Could not delete receipt file {}: {}", file, e.getMessage());
            return false;
        }
    }

    /**
     * Final location of a receipt's file.
     */
    public Path pathFor(long companyId, long receiptId) {
        return companyDirectory(companyId).resolve(receiptId + ".pdf");
    }

    public Path getUploadRoot() {
        return uploadRoot;
    }

    private Path companyDirectory(long companyId) {
        return uploadRoot.resolve(Long.toString(companyId));
    }

    private static String safeName(String originalFileName) {
        if (originalFileName == null || originalFileName.isBlank()) {
            return "upload";
        }
        Path name = Paths.get(originalFileName.replace('\\', '/')).getFileName();
        return name == null ? "upload" : name.toString();
    }
}

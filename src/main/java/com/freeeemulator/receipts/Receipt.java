package com.freeeemulator.receipts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * An uploaded receipt file (証憑) and its metadata.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Receipt {

    private long id;
    private long companyId;
    private LocalDate issueDate;
    private String description;
    private ReceiptStatus status;

    /** Name of the file as uploaded. */
    private String fileName;

    /** Where the file is stored: {@code <uploadRoot>/<companyId>/<id>.pdf}. */
    private String filePath;

    private Instant createdAt;
    private Instant updatedAt;
}

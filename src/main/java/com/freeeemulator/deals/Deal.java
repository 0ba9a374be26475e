package com.freeeemulator.deals;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * A business transaction (取引): what was bought or sold, and how it was paid.
 *
 * The amount is derived: the sum of every detail's amount plus its VAT.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Deal {

    private long id;
    private long companyId;
    private LocalDate issueDate;
    private LocalDate dueDate;
    private DealType type;
    private List<DealDetail> details;

    /**
     * Null when the deal was created without payments.
     */
    private List<DealPayment> payments;

    private long amount;
    private String refNumber;
    private Long partnerId;
    private Instant createdAt;
    private Instant updatedAt;
}

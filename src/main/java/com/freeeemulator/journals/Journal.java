package com.freeeemulator.journals;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * A manual journal entry (振替伝票).
 *
 * Debits and credits are stored as given; keeping them equal is up to the caller.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Journal {

    private long id;
    private long companyId;
    private LocalDate issueDate;
    private List<JournalDetail> details;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Whether the debit lines and the credit lines sum to the same amount.
     */
    @JsonIgnore
    public boolean isBalanced() {
        return totalOf(EntryType.DEBIT) == totalOf(EntryType.CREDIT);
    }

    public long totalOf(EntryType entryType) {
        if (details == null) {
            return 0;
        }
        return details.stream()
            .filter(detail -> detail.getEntryType() == entryType)
            .mapToLong(JournalDetail::getAmount)
            .sum();
    }
}

package com.freeeemulator.deals;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

/**
 * Fields of a partial deal update; null means unchanged.
 * New details replace the old ones and recompute the deal amount.
 */
@Data
@Builder
public class DealUpdate {

    private LocalDate issueDate;
    private LocalDate dueDate;
    private String refNumber;
    private Long partnerId;
    private List<DealDetail> details;
}

package com.freeeemulator.deals;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One account-item line of a deal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DealDetail {

    private long id;
    private long accountItemId;
    private String accountItemName;
    private int taxCode;
    private long amount;
    private long vat;
    private String description;
}

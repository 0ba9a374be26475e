package com.freeeemulator.accountitems;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An entry of the chart of accounts (勘定科目).
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AccountItem {

    private long id;
    private String name;

    /** asset, liability, equity, income or expense */
    private String accountCategory;

    private int defaultTaxCode;
}

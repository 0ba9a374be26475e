package com.freeeemulator.journals;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JournalDetail {

    private long id;
    private EntryType entryType;
    private long accountItemId;
    private String accountItemName;
    private int taxCode;
    private Long partnerId;
    private long amount;
    private long vat;
    private String description;
}

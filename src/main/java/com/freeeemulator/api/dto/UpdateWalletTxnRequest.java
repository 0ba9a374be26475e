package com.freeeemulator.api.dto;

import jakarta.validation.constraints.Pattern;
import lombok.Data;

/**
 * Partial update: only the fields present are applied.
 */
@Data
public class UpdateWalletTxnRequest {

    @Pattern(regexp = "unbooked|settled|1|2", message = "Invalid status")
    private String status;

    private Long dealId;

    private String description;
}

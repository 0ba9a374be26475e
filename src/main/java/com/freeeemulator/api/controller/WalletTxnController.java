package com.freeeemulator.api.controller;

import com.freeeemulator.api.dto.CreateWalletTxnRequest;
import com.freeeemulator.api.dto.UpdateWalletTxnRequest;
import com.freeeemulator.walletables.WalletableType;
import com.freeeemulator.wallettxns.EntrySide;
import com.freeeemulator.wallettxns.WalletTxn;
import com.freeeemulator.wallettxns.WalletTxnService;
import com.freeeemulator.wallettxns.WalletTxnStatus;
import com.freeeemulator.wallettxns.WalletTxnUpdate;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for wallet transactions (明細).
 */
@RestController
@RequestMapping("/api/1/wallet_txns")
@RequiredArgsConstructor
@Tag(name = "Wallet transactions", description = "Statement lines of walletables")
public class WalletTxnController {

    private final WalletTxnService walletTxnService;

    @GetMapping
    @Operation(summary = "List wallet transactions, filtered by company and status (1/unbooked, 2/settled)")
    public ResponseEntity<Map<String, Object>> listWalletTxns(
            @RequestParam(name = "company_id", required = false) Long companyId,
            @RequestParam(name = "status", required = false) String status) {
        WalletTxnStatus statusFilter = status == null || status.isBlank() ? null : WalletTxnStatus.parse(status);
        List<WalletTxn> walletTxns = walletTxnService.listWalletTxns(companyId, statusFilter);
        return ResponseEntity.ok(Map.of("wallet_txns", walletTxns));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a wallet transaction")
    public ResponseEntity<Map<String, Object>> getWalletTxn(@PathVariable long id) {
        return ResponseEntity.ok(Map.of("wallet_txn", walletTxnService.getWalletTxn(id)));
    }

    @PostMapping
    @Operation(summary = "Create an unbooked wallet transaction")
    public ResponseEntity<Map<String, Object>> createWalletTxn(@Valid @RequestBody CreateWalletTxnRequest request) {
        WalletTxn draft = WalletTxn.builder()
            .companyId(request.getCompanyId())
            .date(request.getDate())
            .amount(request.getAmount())
            .entrySide(request.getEntrySide() == null ? null : EntrySide.parse(request.getEntrySide()))
            .walletableType(WalletableType.fromCode(request.getWalletableType()).orElse(null))
            .walletableId(request.getWalletableId())
            .description(request.getDescription())
            .build();

        WalletTxn created = walletTxnService.createWalletTxn(draft);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("wallet_txn", created));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update status, deal link or description of a wallet transaction")
    public ResponseEntity<Map<String, Object>> updateWalletTxn(
            @PathVariable long id,
            @Valid @RequestBody UpdateWalletTxnRequest request) {
        WalletTxnUpdate update = WalletTxnUpdate.builder()
            .status(request.getStatus() == null ? null : WalletTxnStatus.parse(request.getStatus()))
            .dealId(request.getDealId())
            .description(request.getDescription())
            .build();

        return ResponseEntity.ok(Map.of("wallet_txn", walletTxnService.updateWalletTxn(id, update)));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a wallet transaction")
    public ResponseEntity<Void> deleteWalletTxn(@PathVariable long id) {
        walletTxnService.deleteWalletTxn(id);
        return ResponseEntity.noContent().build();
    }
}

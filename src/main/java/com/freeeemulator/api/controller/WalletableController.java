package com.freeeemulator.api.controller;

import com.freeeemulator.walletables.Walletable;
import com.freeeemulator.walletables.WalletableCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for walletables (口座): bank accounts, credit cards and wallets.
 */
@RestController
@RequestMapping("/api/1/walletables")
@RequiredArgsConstructor
@Tag(name = "Walletables", description = "Bank accounts, credit cards and wallets")
public class WalletableController {

    private final WalletableCatalog walletableCatalog;

    @GetMapping
    @Operation(summary = "List walletables of a company, optionally of one type")
    public ResponseEntity<Map<String, Object>> listWalletables(
            @RequestParam(name = "company_id") long companyId,
            @RequestParam(name = "type", required = false) String type) {
        List<Walletable> walletables = type == null || type.isBlank()
            ? walletableCatalog.findAll()
            : walletableCatalog.findByTypeCode(type);
        return ResponseEntity.ok(Map.of("walletables", walletables));
    }
}

package com.freeeemulator.api.controller;

import com.freeeemulator.accountitems.AccountItemCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST API for the chart of accounts (勘定科目).
 */
@RestController
@RequestMapping("/api/1/account_items")
@RequiredArgsConstructor
@Tag(name = "Account items", description = "Chart of accounts")
public class AccountItemController {

    private final AccountItemCatalog accountItemCatalog;

    @GetMapping
    @Operation(summary = "List account items of a company")
    public ResponseEntity<Map<String, Object>> listAccountItems(
            @RequestParam(name = "company_id") long companyId) {
        return ResponseEntity.ok(Map.of("account_items", accountItemCatalog.findAll()));
    }
}

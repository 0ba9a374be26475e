package com.freeeemulator.api.controller;

import com.freeeemulator.api.dto.CreateDealRequest;
import com.freeeemulator.api.dto.DealDetailRequest;
import com.freeeemulator.api.dto.DealPaymentRequest;
import com.freeeemulator.api.dto.UpdateDealRequest;
import com.freeeemulator.deals.Deal;
import com.freeeemulator.deals.DealDetail;
import com.freeeemulator.deals.DealPayment;
import com.freeeemulator.deals.DealService;
import com.freeeemulator.deals.DealType;
import com.freeeemulator.deals.DealUpdate;
import com.freeeemulator.walletables.WalletableType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API for deals (取引).
 *
 * Creating a deal with payments settles the unbooked wallet transactions they match.
 */
@RestController
@RequestMapping("/api/1/deals")
@RequiredArgsConstructor
@Tag(name = "Deals", description = "Income and expense deals")
public class DealController {

    private final DealService dealService;

    @GetMapping
    @Operation(summary = "List deals of a company")
    public ResponseEntity<Map<String, Object>> listDeals(
            @RequestParam(name = "company_id", required = false) Long companyId) {
        return ResponseEntity.ok(Map.of("deals", dealService.listDeals(companyId)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a deal")
    public ResponseEntity<Map<String, Object>> getDeal(@PathVariable long id) {
        return ResponseEntity.ok(Map.of("deal", dealService.getDeal(id)));
    }

    @PostMapping
    @Operation(summary = "Create a deal and settle matching wallet transactions")
    public ResponseEntity<Map<String, Object>> createDeal(@Valid @RequestBody CreateDealRequest request) {
        Deal draft = Deal.builder()
            .companyId(request.getCompanyId())
            .issueDate(request.getIssueDate())
            .dueDate(request.getDueDate())
            .type(DealType.parse(request.getType()))
            .details(toDetails(request.getDetails()))
            .payments(toPayments(request.getPayments()))
            .refNumber(request.getRefNumber())
            .partnerId(request.getPartnerId())
            .build();

        Deal created = dealService.createDeal(draft);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("deal", created));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a deal")
    public ResponseEntity<Map<String, Object>> updateDeal(
            @PathVariable long id,
            @Valid @RequestBody UpdateDealRequest request) {
        DealUpdate update = DealUpdate.builder()
            .issueDate(request.getIssueDate())
            .dueDate(request.getDueDate())
            .refNumber(request.getRefNumber())
            .partnerId(request.getPartnerId())
            .details(request.getDetails() == null ? null : toDetails(request.getDetails()))
            .build();

        return ResponseEntity.ok(Map.of("deal", dealService.updateDeal(id, update)));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a deal; settled wallet transactions stay settled")
    public ResponseEntity<Void> deleteDeal(@PathVariable long id) {
        dealService.deleteDeal(id);
        return ResponseEntity.noContent().build();
    }

    private List<DealDetail> toDetails(List<DealDetailRequest> lines) {
        return lines.stream()
            .map(line -> DealDetail.builder()
                .accountItemId(line.getAccountItemId())
                .taxCode(line.getTaxCode())
                .amount(line.getAmount())
                .description(line.getDescription())
                .build())
            .collect(Collectors.toList());
    }

    private List<DealPayment> toPayments(List<DealPaymentRequest> lines) {
        if (lines == null) {
            return null;
        }
        return lines.stream()
            .map(line -> DealPayment.builder()
                .date(line.getDate())
                .amount(line.getAmount())
                .fromWalletableType(WalletableType.fromCode(line.getFromWalletableType()).orElse(null))
                .fromWalletableId(line.getFromWalletableId())
                .build())
            .collect(Collectors.toList());
    }
}

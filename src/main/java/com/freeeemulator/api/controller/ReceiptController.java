package com.freeeemulator.api.controller;

import com.freeeemulator.common.exception.InvalidParameterException;
import com.freeeemulator.receipts.Receipt;
import com.freeeemulator.receipts.ReceiptService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDate;
import java.util.Map;

/**
 * REST API for receipt uploads (証憑).
 */
@RestController
@RequestMapping("/api/1/receipts")
@RequiredArgsConstructor
@Tag(name = "Receipts", description = "Receipt file uploads")
public class ReceiptController {

    private final ReceiptService receiptService;

    @GetMapping
    @Operation(summary = "List receipts of a company")
    public ResponseEntity<Map<String, Object>> listReceipts(
            @RequestParam(name = "company_id", required = false) Long companyId) {
        return ResponseEntity.ok(Map.of("receipts", receiptService.listReceipts(companyId)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a receipt")
    public ResponseEntity<Map<String, Object>> getReceipt(@PathVariable long id) {
        return ResponseEntity.ok(Map.of("receipt", receiptService.getReceipt(id)));
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload a receipt file")
    public ResponseEntity<Map<String, Object>> createReceipt(
            @RequestParam(name = "company_id") long companyId,
            @RequestParam(name = "issue_date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate issueDate,
            @RequestParam(name = "description", required = false) String description,
            @RequestPart(name = "receipt") MultipartFile file) throws IOException {
        if (companyId <= 0) {
            throw new InvalidParameterException("Invalid company_id");
        }

        Receipt receipt;
        try (InputStream content = file.getInputStream()) {
            receipt = receiptService.createReceipt(companyId, issueDate,
                description == null ? "" : description, file.getOriginalFilename(), content);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("receipt", receipt));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a receipt and its file")
    public ResponseEntity<Void> deleteReceipt(@PathVariable long id) {
        receiptService.deleteReceipt(id);
        return ResponseEntity.noContent().build();
    }
}

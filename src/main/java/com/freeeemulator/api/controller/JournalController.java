package com.freeeemulator.api.controller;

import com.freeeemulator.api.dto.CreateJournalRequest;
import com.freeeemulator.journals.EntryType;
import com.freeeemulator.journals.Journal;
import com.freeeemulator.journals.JournalDetail;
import com.freeeemulator.journals.JournalService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST API for journals (仕訳).
 */
@RestController
@RequestMapping("/api/1/journals")
@RequiredArgsConstructor
@Tag(name = "Journals", description = "Manual journal entries")
public class JournalController {

    private final JournalService journalService;

    @GetMapping
    @Operation(summary = "List journals of a company")
    public ResponseEntity<Map<String, Object>> listJournals(
            @RequestParam(name = "company_id", required = false) Long companyId) {
        return ResponseEntity.ok(Map.of("journals", journalService.listJournals(companyId)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a journal")
    public ResponseEntity<Map<String, Object>> getJournal(@PathVariable long id) {
        return ResponseEntity.ok(Map.of("journal", journalService.getJournal(id)));
    }

    @PostMapping
    @Operation(summary = "Create a journal")
    public ResponseEntity<Map<String, Object>> createJournal(@Valid @RequestBody CreateJournalRequest request) {
        Journal draft = Journal.builder()
            .companyId(request.getCompanyId())
            .issueDate(request.getIssueDate())
            .details(request.getDetails().stream()
                .map(line -> JournalDetail.builder()
                    .entryType(EntryType.parse(line.getEntryType()))
                    .accountItemId(line.getAccountItemId())
                    .taxCode(line.getTaxCode())
                    .partnerId(line.getPartnerId())
                    .amount(line.getAmount())
                    .vat(line.getVat())
                    .description(line.getDescription())
                    .build())
                .collect(Collectors.toList()))
            .build();

        Journal created = journalService.createJournal(draft);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("journal", created));
    }
}

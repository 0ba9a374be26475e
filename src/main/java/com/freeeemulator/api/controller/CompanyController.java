package com.freeeemulator.api.controller;

import com.freeeemulator.companies.CompanyCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/1/companies")
@RequiredArgsConstructor
@Tag(name = "Companies", description = "Companies visible to the token")
public class CompanyController {

    private final CompanyCatalog companyCatalog;

    @GetMapping
    @Operation(summary = "List companies")
    public ResponseEntity<Map<String, Object>> listCompanies() {
        return ResponseEntity.ok(Map.of("companies", companyCatalog.findAll()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a company")
    public ResponseEntity<Map<String, Object>> getCompany(@PathVariable long id) {
        return ResponseEntity.ok(Map.of("company", companyCatalog.get(id)));
    }
}

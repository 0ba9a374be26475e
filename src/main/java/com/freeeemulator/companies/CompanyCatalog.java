package com.freeeemulator.companies;

import com.freeeemulator.common.exception.RecordNotFoundException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Seeded, read-only set of companies.
 */
@Component
public class CompanyCatalog {

    private final List<Company> companies = List.of(
        new Company(1, "Pigeonworks LLC", "合同会社Pigeonworks", "ゴウドウガイシャピジョンワークス")
    );

    public List<Company> findAll() {
        return companies;
    }

    public Company get(long id) {
        return companies.stream()
            .filter(company -> company.getId() == id)
            .findFirst()
            .orElseThrow(() -> new RecordNotFoundException("Company", id));
    }
}

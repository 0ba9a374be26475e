package com.freeeemulator.companies;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A business entity whose books the API exposes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Company {

    private long id;
    private String displayName;
    private String name;
    private String nameKana;
}

package com.e2eq.dats.queries.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One variable (dimension) of a dataset, keyed by dbGaP accessions.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DatasetVariable {
    private String study;         // dbGaP study accession, e.g. phs000424.v7.p2
    private String variableId;    // dbGaP variable accession, e.g. phv00169061.v7.p2
    private String name;
    private String description;
}

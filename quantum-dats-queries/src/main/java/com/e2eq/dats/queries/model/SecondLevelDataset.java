package com.e2eq.dats.queries.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SecondLevelDataset {
    private String parentId;
    private String datasetId;
    private String title;
}

package com.e2eq.dats.queries.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StudyGroupMember {
    private String datasetId;
    private String groupName;
    private String memberName;
}

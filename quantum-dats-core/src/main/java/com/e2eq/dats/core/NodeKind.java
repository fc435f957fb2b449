package com.e2eq.dats.core;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Known DATS node kinds. Type tags outside this set are still accepted and map to {@link #GENERIC}.
 */
public enum NodeKind {
    DATASET("Dataset"),
    STUDY("Study"),
    STUDY_GROUP("StudyGroup"),
    MATERIAL("Material"),
    DIMENSION("Dimension"),
    IDENTIFIER("Identifier"),
    ALTERNATE_IDENTIFIER("AlternateIdentifier"),
    RELATED_IDENTIFIER("RelatedIdentifier"),
    ANNOTATION("Annotation"),
    CONSENT_INFO("ConsentInfo"),
    DATA_TYPE("DataType"),
    DATASET_DISTRIBUTION("DatasetDistribution"),
    ACCESS("Access"),
    PERSON("Person"),
    ORGANIZATION("Organization"),
    CATEGORY_VALUE("CategoryValue"),
    GENERIC(null);

    private static final Map<String, NodeKind> BY_TYPE = Arrays.stream(values())
            .filter(k -> k.type != null)
            .collect(Collectors.toUnmodifiableMap(k -> k.type, Function.identity()));

    private final String type;

    NodeKind(String type) {
        this.type = type;
    }

    /**
     * The DATS type tag, or null for {@link #GENERIC}.
     */
    public String type() {
        return type;
    }

    public static NodeKind fromType(String type) {
        return type == null ? GENERIC : BY_TYPE.getOrDefault(type, GENERIC);
    }
}

package com.nicuanalytics.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ReferenceCodeSets {

    public static final ReferenceCodeSets EMPTY = ReferenceCodeSets.builder().build();

    @Singular("birthweightCategory")
    Map<String, String> birthweightCategories;

    @Singular("gestationalAgeCategory")
    Map<String, String> gestationalAgeCategories;
}

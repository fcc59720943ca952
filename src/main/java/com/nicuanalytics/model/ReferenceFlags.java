package com.nicuanalytics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ReferenceFlags {

    public static final ReferenceFlags NONE = ReferenceFlags.builder().build();

    boolean newbornIcd;
    boolean newbornRevenue;
    boolean single;
    boolean twin;
    boolean multiple;
    boolean nicuRevenue;
    boolean nicuMsDrg;
    boolean nicuAprDrg;

    @JsonIgnore
    public boolean isNewborn() {
        return newbornIcd || newbornRevenue;
    }

    @JsonIgnore
    public boolean isAnyNicu() {
        return nicuRevenue || nicuMsDrg || nicuAprDrg;
    }

    @JsonIgnore
    public boolean isAnyNicuDrg() {
        return nicuMsDrg || nicuAprDrg;
    }
}

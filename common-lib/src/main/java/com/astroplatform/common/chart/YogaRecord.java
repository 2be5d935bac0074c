package com.astroplatform.common.chart;

import java.util.List;

public record YogaRecord(
    String        name,
    YogaCategory  category,
    List<Planet>  planetsInvolved,
    List<Integer> housesInvolved,
    Strength      strength,
    String        effects
) {
    public YogaRecord {
        planetsInvolved = planetsInvolved == null ? List.of() : List.copyOf(planetsInvolved);
        housesInvolved  = housesInvolved  == null ? List.of() : List.copyOf(housesInvolved);
    }
}

package com.baykanat.insider.analytics.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/** Doğrulanmış tek filtre: parametre, operatör ve OR'lanacak değerler (sıra korunur). */
@Value
@Builder
public class FilterPredicate {

    FilterParameter parameter;
    FilterType type;
    List<String> values;
}

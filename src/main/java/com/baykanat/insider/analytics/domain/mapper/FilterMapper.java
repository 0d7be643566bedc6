package com.baykanat.insider.analytics.domain.mapper;

import com.baykanat.insider.analytics.api.dto.FilterRequest;
import com.baykanat.insider.analytics.domain.exception.InvalidParameterException;
import com.baykanat.insider.analytics.domain.model.FilterParameter;
import com.baykanat.insider.analytics.domain.model.FilterPredicate;
import com.baykanat.insider.analytics.domain.model.FilterType;
import com.baykanat.insider.analytics.domain.query.FilterAllowList;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mapstruct.Context;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

import java.util.List;

/** filters JSON ↔ FilterRequest ↔ FilterPredicate dönüşümleri. MapStruct + Jackson. */
@Mapper(componentModel = "spring")
public interface FilterMapper {

    /** filters JSON'u için paylaşılan ObjectMapper. */
    ObjectMapper JSON_MAPPER = new ObjectMapper();

    String FIELD = "filters";

    /** FilterRequest → FilterPredicate; parametre allow-list'ten, operatör enum'dan çözülür. */
    @Mapping(target = "parameter", source = "parameter", qualifiedByName = "toParameter")
    @Mapping(target = "type", source = "type", qualifiedByName = "toType")
    @Mapping(target = "values", source = "value")
    FilterPredicate toPredicate(FilterRequest request, @Context FilterAllowList allowList);

    List<FilterPredicate> toPredicates(List<FilterRequest> requests, @Context FilterAllowList allowList);

    /** FilterPredicate → FilterRequest; ham adlar geri yazılır. */
    @Mapping(target = "parameter", source = "parameter", qualifiedByName = "parameterName")
    @Mapping(target = "type", source = "type", qualifiedByName = "typeName")
    @Mapping(target = "value", source = "values")
    FilterRequest toRequest(FilterPredicate predicate);

    List<FilterRequest> toRequests(List<FilterPredicate> predicates);

    /** JSON dizisini FilterRequest listesine çözer; boş/null girdi boş liste. */
    default List<FilterRequest> decode(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            List<FilterRequest> requests = JSON_MAPPER.readValue(json, new TypeReference<List<FilterRequest>>() {
            });
            return requests == null ? List.of() : requests;
        } catch (JsonProcessingException e) {
            throw new InvalidParameterException(FIELD, "Filters must be a JSON array of {parameter, type, value}", e);
        }
    }

    /** Predicate listesini filters sorgu parametresi biçimine yazar. */
    default String encode(List<FilterPredicate> predicates) {
        try {
            return JSON_MAPPER.writeValueAsString(toRequests(predicates));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Filter list could not be serialized", e);
        }
    }

    @Named("toParameter")
    default FilterParameter toParameter(String name, @Context FilterAllowList allowList) {
        return allowList.resolve(name)
                .orElseThrow(() -> new InvalidParameterException(FIELD, "Unsupported filter parameter: " + name));
    }

    @Named("toType")
    default FilterType toType(String type) {
        return FilterType.fromValue(type)
                .orElseThrow(() -> new InvalidParameterException(FIELD, "Unsupported filter type: " + type));
    }

    @Named("parameterName")
    default String parameterName(FilterParameter parameter) {
        return parameter == null ? null : parameter.getName();
    }

    @Named("typeName")
    default String typeName(FilterType type) {
        return type == null ? null : type.getValue();
    }
}

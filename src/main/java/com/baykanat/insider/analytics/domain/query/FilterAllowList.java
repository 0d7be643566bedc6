package com.baykanat.insider.analytics.domain.query;

import com.baykanat.insider.analytics.config.AppProperties;
import com.baykanat.insider.analytics.domain.model.FilterParameter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * SQL identifier'a dönüşebilecek filtre parametreleri. Açılışta bir kez yüklenir, sonra değişmez.
 *
 * <p>Sütunlar birebir eşleşir; yalnızca {@code utm_} ve {@code url_param:} aileleri önekle tanınır.
 */
@Slf4j
@Component
public class FilterAllowList {

    private static final Pattern IDENTIFIER = Pattern.compile("[a-z][a-z0-9_]*");

    private static final Map<String, FilterParameter.Kind> VIRTUAL_PARAMETERS = Map.of(
            "referrer", FilterParameter.Kind.REFERRER,
            "entry_page", FilterParameter.Kind.ENTRY_PAGE,
            "exit_page", FilterParameter.Kind.EXIT_PAGE,
            "dimensions", FilterParameter.Kind.DIMENSIONS
    );

    private final Set<String> columns;

    public FilterAllowList(AppProperties appProperties) {
        Set<String> columns = Set.copyOf(appProperties.getFilters().getColumns());
        for (String column : columns) {
            if (!IDENTIFIER.matcher(column).matches()) {
                throw new IllegalStateException("Filter column is not a plain identifier: " + column);
            }
            if (VIRTUAL_PARAMETERS.containsKey(column)) {
                throw new IllegalStateException("Filter column shadows a virtual parameter: " + column);
            }
        }
        this.columns = columns;
        log.info("Filter allow-list loaded with {} columns", this.columns.size());
    }

    /** Ham parametre adını çözer; allow-list dışındaysa boş döner. */
    public Optional<FilterParameter> resolve(String name) {
        if (name == null || name.isEmpty()) {
            return Optional.empty();
        }
        FilterParameter.Kind virtualKind = VIRTUAL_PARAMETERS.get(name);
        if (virtualKind != null) {
            return Optional.of(FilterParameter.virtual(name, virtualKind));
        }
        if (columns.contains(name)) {
            return Optional.of(FilterParameter.column(name));
        }
        if (name.startsWith(FilterParameter.UTM_PREFIX) && name.length() > FilterParameter.UTM_PREFIX.length()) {
            return Optional.of(FilterParameter.utm(name));
        }
        if (name.startsWith(FilterParameter.URL_PARAM_PREFIX)
                && name.length() > FilterParameter.URL_PARAM_PREFIX.length()) {
            return Optional.of(FilterParameter.urlParam(name));
        }
        return Optional.empty();
    }
}

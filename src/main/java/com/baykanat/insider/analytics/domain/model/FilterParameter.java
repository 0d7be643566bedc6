package com.baykanat.insider.analytics.domain.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Allow-list'ten geçmiş filtre hedefi.
 *
 * <p>{@code name} istemcinin gönderdiği ham addır (ör. {@code url_param:ref});
 * {@code key} yalnızca UTM ve URL parametreleri için map anahtarını tutar.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FilterParameter {

    public static final String UTM_PREFIX = "utm_";
    public static final String URL_PARAM_PREFIX = "url_param:";

    public enum Kind {
        COLUMN,
        UTM,
        URL_PARAM,
        REFERRER,
        ENTRY_PAGE,
        EXIT_PAGE,
        DIMENSIONS
    }

    String name;
    Kind kind;
    String key;

    public static FilterParameter column(String name) {
        return new FilterParameter(name, Kind.COLUMN, null);
    }

    public static FilterParameter utm(String name) {
        return new FilterParameter(name, Kind.UTM, name);
    }

    public static FilterParameter urlParam(String name) {
        return new FilterParameter(name, Kind.URL_PARAM, name.substring(URL_PARAM_PREFIX.length()));
    }

    public static FilterParameter virtual(String name, Kind kind) {
        return new FilterParameter(name, kind, null);
    }

    public boolean isSessionScoped() {
        return kind == Kind.ENTRY_PAGE || kind == Kind.EXIT_PAGE;
    }
}

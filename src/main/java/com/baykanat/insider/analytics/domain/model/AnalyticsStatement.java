package com.baykanat.insider.analytics.domain.model;

import lombok.Value;

import java.util.List;

/** Çalıştırılmaya hazır SQL ve "?" sırasıyla bağlanacak değerler; name yalnızca loglama içindir. */
@Value
public class AnalyticsStatement {

    String name;
    String sql;
    List<Object> args;
}

package com.baykanat.insider.analytics.domain.query;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * SQL metni ve metindeki "?" yer tutucularına sırayla bağlanacak değerler.
 *
 * <p>Kullanıcıdan gelen değerler yalnızca {@link #value(Object)} ile girer; SQL metnine
 * doğrudan yazılan parçalar sabitler, allow-list identifier'ları ve sayılardır.
 */
@Value
public class SqlFragment {

    private static final Pattern PLACEHOLDER = Pattern.compile("%(\\d+)\\$[sd]");
    private static final SqlFragment EMPTY = new SqlFragment("", List.of());

    String sql;
    List<Object> args;

    public SqlFragment(String sql, List<Object> args) {
        this.sql = sql;
        this.args = Collections.unmodifiableList(new ArrayList<>(args));
    }

    public static SqlFragment empty() {
        return EMPTY;
    }

    /** Argümansız sabit SQL. */
    public static SqlFragment of(String sql) {
        return new SqlFragment(sql, List.of());
    }

    /** Tek bir bağlı değer: "?". */
    public static SqlFragment value(Object value) {
        return new SqlFragment("?", Collections.singletonList(value));
    }

    public boolean isEmpty() {
        return sql.isEmpty();
    }

    /** Boş olmayan parçaları ayraçla birleştirir; argümanlar metin sırasını izler. */
    public static SqlFragment join(String delimiter, Collection<SqlFragment> fragments) {
        StringBuilder sql = new StringBuilder();
        List<Object> args = new ArrayList<>();
        for (SqlFragment fragment : fragments) {
            if (fragment.isEmpty()) {
                continue;
            }
            if (!sql.isEmpty()) {
                sql.append(delimiter);
            }
            sql.append(fragment.sql);
            args.addAll(fragment.args);
        }
        return new SqlFragment(sql.toString(), args);
    }

    /**
     * {@code %N$s} / {@code %N$d} yer tutucularını doldurur. SqlFragment parçalarının argümanları
     * her geçtiği yerde, metindeki sırayla eklenir; diğer parçalar olduğu gibi yazılır.
     */
    public static SqlFragment format(String template, Object... parts) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sql = new StringBuilder();
        List<Object> args = new ArrayList<>();
        while (matcher.find()) {
            Object part = parts[Integer.parseInt(matcher.group(1)) - 1];
            if (part instanceof SqlFragment fragment) {
                matcher.appendReplacement(sql, Matcher.quoteReplacement(fragment.sql));
                args.addAll(fragment.args);
            } else {
                matcher.appendReplacement(sql, Matcher.quoteReplacement(String.valueOf(part)));
            }
        }
        matcher.appendTail(sql);
        return new SqlFragment(sql.toString(), args);
    }
}

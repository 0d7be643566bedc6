package com.baykanat.insider.analytics.domain.query;

import com.baykanat.insider.analytics.domain.model.FilterParameter;
import com.baykanat.insider.analytics.domain.model.FilterPredicate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Doğrulanmış filtre listesini "AND ..." ile başlayan SQL parçasına çevirir.
 *
 * <p>Aynı filtredeki değerler OR, filtreler AND ile birleşir. entry_page/exit_page düz sütun
 * karşılaştırması değil, site kapsamlı oturum alt sorgusuna dönüşür.
 */
@Component
public class FilterCompiler {

    private static final String SESSION_PREDICATE = """
            session_id IN (SELECT session_id FROM (SELECT session_id, %1$s AS %2$s FROM %3$s WHERE %4$s GROUP BY session_id) WHERE %5$s)""";

    public SqlFragment compile(List<FilterPredicate> filters, int siteId) {
        if (filters == null || filters.isEmpty()) {
            return SqlFragment.empty();
        }
        SqlFragment predicates = SqlFragment.join(" AND ", filters.stream()
                .map(filter -> compilePredicate(filter, siteId))
                .toList());
        return SqlFragment.format("AND %1$s", predicates);
    }

    private SqlFragment compilePredicate(FilterPredicate filter, int siteId) {
        FilterParameter parameter = filter.getParameter();
        if (parameter.isSessionScoped()) {
            return sessionPredicate(filter, siteId);
        }
        return comparisons(columnExpression(parameter), filter);
    }

    private SqlFragment sessionPredicate(FilterPredicate filter, int siteId) {
        boolean entry = filter.getParameter().getKind() == FilterParameter.Kind.ENTRY_PAGE;
        String alias = entry ? "entry_pathname" : "exit_pathname";
        String expression = entry ? SessionExpressions.ENTRY_PAGE : SessionExpressions.EXIT_PAGE;

        return SqlFragment.format(SESSION_PREDICATE,
                expression, alias, SessionExpressions.EVENTS_TABLE, SessionExpressions.siteScope(siteId),
                comparisons(SqlFragment.of(alias), filter));
    }

    /** Tek değer parantezsiz, birden fazla değer parantez içinde OR. Değerler "?" ile bağlanır. */
    private SqlFragment comparisons(SqlFragment lhs, FilterPredicate filter) {
        List<SqlFragment> parts = filter.getValues().stream()
                .map(value -> SqlFragment.format("%1$s %2$s %3$s",
                        lhs, filter.getType().getOperator(), SqlFragment.value(filter.getType().decorate(value))))
                .toList();
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return SqlFragment.format("(%1$s)", SqlFragment.join(" OR ", parts));
    }

    /** Parametre → sütun ifadesi. Identifier'lar yalnızca allow-list'ten gelir; map anahtarı bağlanır. */
    SqlFragment columnExpression(FilterParameter parameter) {
        return switch (parameter.getKind()) {
            case COLUMN -> SqlFragment.of(parameter.getName());
            case UTM, URL_PARAM -> SqlFragment.format("url_parameters[%1$s]", SqlFragment.value(parameter.getKey()));
            case REFERRER -> SqlFragment.of("domainWithoutWWW(referrer)");
            case DIMENSIONS -> SqlFragment.of("concat(toString(screen_width), 'x', toString(screen_height))");
            case ENTRY_PAGE, EXIT_PAGE -> throw new IllegalArgumentException(
                    "Session scoped parameter has no column expression: " + parameter.getName());
        };
    }
}

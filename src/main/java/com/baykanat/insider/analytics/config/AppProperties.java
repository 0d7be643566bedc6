package com.baykanat.insider.analytics.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** app.* için tip güvenli configuration (sayfalama, filtre allow-list'i, site erişimi). */
@Configuration
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private PaginationProperties pagination = new PaginationProperties();
    private FilterProperties filters = new FilterProperties();
    private AccessProperties access = new AccessProperties();

    @Getter
    @Setter
    public static class PaginationProperties {
        /** Oturum listesinin sabit sayfa boyu; dolu sayfa "devamı olabilir" demektir. */
        private int sessionPageSize = 100;
        /** pageSize ve limit gönderilmediğinde. */
        private int defaultPageSize = 100;
    }

    @Getter
    @Setter
    public static class FilterProperties {
        /** SQL identifier olarak kullanılabilecek event sütunları. */
        private List<String> columns = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class AccessProperties {
        private String apiKeyHeader = "X-Api-Key";
        /** Anahtarsız okunabilen siteler. */
        private Set<Integer> publicSites = new HashSet<>();
        /** site id → API key. */
        private Map<Integer, String> apiKeys = new HashMap<>();
    }
}

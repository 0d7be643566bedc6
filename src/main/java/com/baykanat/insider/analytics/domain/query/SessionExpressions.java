package com.baykanat.insider.analytics.domain.query;

/**
 * Oturum yeniden kurulumunda paylaşılan SQL parçaları.
 *
 * <p>Giriş/çıkış sayfası en küçük/en büyük timestamp'teki pathname'dir. Aynı timestamp'e sahip
 * olaylarda giriş için sözlük sırasında en küçük, çıkış için en büyük pathname seçilir.
 */
public final class SessionExpressions {

    public static final String EVENTS_TABLE = "events";

    public static final String ENTRY_PAGE = "argMin(pathname, (timestamp, pathname))";
    public static final String EXIT_PAGE = "argMax(pathname, (timestamp, pathname))";

    public static final String IS_PAGEVIEW = "type = 'pageview'";
    public static final String IS_CUSTOM_EVENT = "type = 'custom_event'";

    private SessionExpressions() {
    }

    public static String siteScope(int siteId) {
        return "site_id = " + siteId;
    }
}

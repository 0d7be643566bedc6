package com.baykanat.insider.analytics.domain.exception;

/** İstemcinin siteye erişimi yok; sorgu oluşturulmadan 403 döner. */
public class UnauthorizedSiteAccessException extends RuntimeException {

    private final int siteId;

    public UnauthorizedSiteAccessException(int siteId) {
        super("Access to site " + siteId + " is not permitted");
        this.siteId = siteId;
    }

    public int getSiteId() {
        return siteId;
    }
}

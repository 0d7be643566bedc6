package com.baykanat.insider.analytics.domain.service;

import com.baykanat.insider.analytics.config.AppProperties;
import com.baykanat.insider.analytics.domain.exception.UnauthorizedSiteAccessException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Site erişim kontrolü. Public siteler anahtarsız, diğerleri sitenin API key'i ile okunur.
 * Kontrol, sorgu oluşturulmadan önce istek başına bir kez yapılır.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SiteAccessService {

    private final AppProperties appProperties;
    private final ParameterValidator parameterValidator;

    public boolean hasAccess(HttpServletRequest request, int siteId) {
        AppProperties.AccessProperties access = appProperties.getAccess();
        if (access.getPublicSites().contains(siteId)) {
            return true;
        }
        String expected = access.getApiKeys().get(siteId);
        String supplied = request.getHeader(access.getApiKeyHeader());
        if (expected == null || supplied == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                supplied.getBytes(StandardCharsets.UTF_8));
    }

    /** Site parametresini doğrular ve erişim yoksa istisna fırlatır; doğrulanmış site id'yi döner. */
    public int requireAccess(HttpServletRequest request, String site) {
        int siteId = parameterValidator.validateSite(site);
        if (!hasAccess(request, siteId)) {
            log.warn("Rejected analytics request for site_id={} from {}", siteId, request.getRemoteAddr());
            throw new UnauthorizedSiteAccessException(siteId);
        }
        return siteId;
    }
}

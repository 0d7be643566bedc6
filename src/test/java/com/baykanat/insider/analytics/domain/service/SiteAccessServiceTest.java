package com.baykanat.insider.analytics.domain.service;

import com.baykanat.insider.analytics.config.AppProperties;
import com.baykanat.insider.analytics.domain.exception.UnauthorizedSiteAccessException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SiteAccessServiceTest {

    @Mock
    private ParameterValidator parameterValidator;

    private SiteAccessService siteAccessService;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.getAccess().setPublicSites(Set.of(1));
        properties.getAccess().setApiKeys(Map.of(2, "secret-2"));
        siteAccessService = new SiteAccessService(properties, parameterValidator);
    }

    @Test
    @DisplayName("Public site should be readable without a key")
    void publicSiteIsReadable() {
        assertThat(siteAccessService.hasAccess(new MockHttpServletRequest(), 1)).isTrue();
    }

    @Test
    @DisplayName("Private site should require its own API key")
    void privateSiteRequiresKey() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        assertThat(siteAccessService.hasAccess(request, 2)).isFalse();

        request.addHeader("X-Api-Key", "secret-3");
        assertThat(siteAccessService.hasAccess(request, 2)).isFalse();

        MockHttpServletRequest authorized = new MockHttpServletRequest();
        authorized.addHeader("X-Api-Key", "secret-2");
        assertThat(siteAccessService.hasAccess(authorized, 2)).isTrue();
    }

    @Test
    @DisplayName("Unconfigured site should be denied")
    void unknownSiteIsDenied() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Api-Key", "secret-2");

        assertThat(siteAccessService.hasAccess(request, 3)).isFalse();
    }

    @Test
    @DisplayName("requireAccess should throw for denied sites")
    void requireAccessThrows() {
        when(parameterValidator.validateSite("2")).thenReturn(2);

        assertThatThrownBy(() -> siteAccessService.requireAccess(new MockHttpServletRequest(), "2"))
                .isInstanceOf(UnauthorizedSiteAccessException.class);
    }
}

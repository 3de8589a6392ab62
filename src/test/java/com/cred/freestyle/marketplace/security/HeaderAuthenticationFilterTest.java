package com.cred.freestyle.marketplace.security;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("HeaderAuthenticationFilter Tests")
class HeaderAuthenticationFilterTest {

    private final HeaderAuthenticationFilter filter = new HeaderAuthenticationFilter();

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    @DisplayName("doFilter - User header authenticates with the default USER role")
    void doFilter_UserHeader() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/payments/transactions");
        request.addHeader(HeaderAuthenticationFilter.USER_ID_HEADER, " user-123 ");
        FilterChain chain = new MockFilterChain();

        // When
        filter.doFilter(request, new MockHttpServletResponse(), chain);

        // Then
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        assertThat(authentication).isNotNull();
        assertThat(authentication.getPrincipal()).isEqualTo("user-123");
        assertThat(authentication.getAuthorities()).extracting(GrantedAuthority::getAuthority)
                .containsExactly("ROLE_USER");
        assertThat(SecurityUtils.getCurrentUserId()).isEqualTo("user-123");
        assertThat(SecurityUtils.isAdmin()).isFalse();
    }

    @Test
    @DisplayName("doFilter - Role header grants that role")
    void doFilter_AdminRole() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/payments/plans");
        request.addHeader(HeaderAuthenticationFilter.USER_ID_HEADER, "admin-1");
        request.addHeader(HeaderAuthenticationFilter.USER_ROLE_HEADER, "admin");

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());

        assertThat(SecurityUtils.isAdmin()).isTrue();
        assertThat(SecurityUtils.hasRole("ROLE_ADMIN")).isTrue();
    }

    @Test
    @DisplayName("doFilter - No user header leaves the request anonymous")
    void doFilter_NoHeader() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/ads");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(SecurityContextHolder.getContext().getAuthentication()).isNull();
        assertThat(SecurityUtils.getCurrentUserId()).isNull();
        assertThat(chain.getRequest()).isSameAs(request);
    }

    @Test
    @DisplayName("toAuthority - Normalizes case and prefix")
    void toAuthority_Normalizes() {
        assertThat(HeaderAuthenticationFilter.toAuthority(null)).isEqualTo("ROLE_USER");
        assertThat(HeaderAuthenticationFilter.toAuthority("  ")).isEqualTo("ROLE_USER");
        assertThat(HeaderAuthenticationFilter.toAuthority("admin")).isEqualTo("ROLE_ADMIN");
        assertThat(HeaderAuthenticationFilter.toAuthority("ROLE_ADMIN")).isEqualTo("ROLE_ADMIN");
    }
}

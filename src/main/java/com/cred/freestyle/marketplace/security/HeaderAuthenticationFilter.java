package com.cred.freestyle.marketplace.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.Locale;

/**
 * Builds the request's Authentication from gateway headers.
 *
 * - X-User-Id: authenticated user (requests without it stay anonymous)
 * - X-User-Role: role, defaults to USER
 *
 * The API gateway validates the user's token and sets these headers; this
 * service trusts them as-is.
 *
 * @author Marketplace Team
 */
public class HeaderAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(HeaderAuthenticationFilter.class);

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    private static final String ROLE_PREFIX = "ROLE_";
    private static final String DEFAULT_ROLE = "USER";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String userId = request.getHeader(USER_ID_HEADER);

        if (userId != null && !userId.isBlank()) {
            String role = toAuthority(request.getHeader(USER_ROLE_HEADER));

            UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                    userId.trim(), null, Collections.singletonList(new SimpleGrantedAuthority(role)));
            SecurityContextHolder.getContext().setAuthentication(authentication);

            logger.debug("Authenticated user: {} with role: {}", userId, role);
        } else {
            logger.debug("No {} header found, request will be unauthenticated", USER_ID_HEADER);
        }

        filterChain.doFilter(request, response);
    }

    static String toAuthority(String roleHeader) {
        String role = roleHeader == null || roleHeader.isBlank()
                ? DEFAULT_ROLE
                : roleHeader.trim().toUpperCase(Locale.ROOT);
        return role.startsWith(ROLE_PREFIX) ? role : ROLE_PREFIX + role;
    }
}

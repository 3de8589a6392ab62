package com.cred.freestyle.marketplace.config;

import com.cred.freestyle.marketplace.security.HeaderAuthenticationFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.method.configuration.EnableMethodSecurity;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Security configuration.
 *
 * Authentication: header based (X-User-Id, X-User-Role), stateless.
 *
 * Public endpoints:
 * - GET /api/v1/payments/plans (plan catalogue)
 * - POST /api/v1/payments/callback (payment gateway; the provider authenticates out of band)
 * - GET /api/v1/ads/** (listing and ad detail)
 * - /actuator/**
 *
 * Plan administration requires the ADMIN role. Everything else requires an authenticated user.
 *
 * @author Marketplace Team
 */
@Configuration
@EnableWebSecurity
@EnableMethodSecurity(prePostEnabled = true)
public class SecurityConfig {

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())

            .authorizeHttpRequests(auth -> auth
                .requestMatchers("/actuator/**").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/v1/payments/plans").permitAll()
                .requestMatchers(HttpMethod.POST, "/api/v1/payments/callback").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/v1/ads", "/api/v1/ads/**").permitAll()
                .requestMatchers("/api/v1/payments/plans/**").hasRole("ADMIN")
                .requestMatchers(HttpMethod.POST, "/api/v1/payments/plans").hasRole("ADMIN")
                .anyRequest().authenticated()
            )

            .sessionManagement(session -> session
                .sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED))
            )

            .addFilterBefore(
                headerAuthenticationFilter(),
                UsernamePasswordAuthenticationFilter.class
            );

        return http.build();
    }

    @Bean
    public HeaderAuthenticationFilter headerAuthenticationFilter() {
        return new HeaderAuthenticationFilter();
    }
}

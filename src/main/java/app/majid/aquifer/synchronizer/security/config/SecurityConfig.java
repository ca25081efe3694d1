package app.majid.aquifer.synchronizer.security.config;

import app.majid.aquifer.synchronizer.security.filter.TokenAuthenticationFilter;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.CsrfConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Security configuration for the Aquifer API.
 * <p>
 * Every call outside actuator and API docs needs a configured token. Running or cancelling a sync
 * needs the {@link ApiScope#SYNC} scope and rolling back needs {@link ApiScope#ROLLBACK}.
 */
@Configuration
@EnableConfigurationProperties(ApiTokenProperties.class)
public class SecurityConfig {

    private static final String API = "/api/synchronizer";

    @Bean
    public TokenAuthenticationFilter tokenAuthenticationFilter(ApiTokenProperties tokenProperties) {
        return new TokenAuthenticationFilter(tokenProperties);
    }

    /**
     * Keeps the servlet container from running the token filter outside the security chain.
     */
    @Bean
    public FilterRegistrationBean<TokenAuthenticationFilter> tokenAuthenticationFilterRegistration(
            TokenAuthenticationFilter tokenAuthenticationFilter) {
        FilterRegistrationBean<TokenAuthenticationFilter> registration =
                new FilterRegistrationBean<>(tokenAuthenticationFilter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                   TokenAuthenticationFilter tokenAuthenticationFilter) throws Exception {
        return http
                .csrf(CsrfConfigurer::disable)
                .sessionManagement(session -> session
                        .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/actuator/**", "/swagger-ui/**", "/v3/api-docs/**").permitAll()
                        .requestMatchers(HttpMethod.POST, API + "/sync", API + "/sync/cancel")
                        .hasAuthority(ApiScope.SYNC.authority())
                        .requestMatchers(HttpMethod.POST, API + "/rollback")
                        .hasAuthority(ApiScope.ROLLBACK.authority())
                        .anyRequest().authenticated())
                .addFilterBefore(tokenAuthenticationFilter, UsernamePasswordAuthenticationFilter.class)
                .build();
    }
}

package app.majid.aquifer.synchronizer.security.filter;

import app.majid.aquifer.synchronizer.security.config.ApiTokenProperties;
import app.majid.aquifer.synchronizer.security.config.ApiTokenProperties.ApiToken;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Authenticates API calls with a configured token in the {@code Authorization} header, sent bare
 * or as {@code Bearer <token>}. The token's scopes become the request's authorities, which
 * {@link app.majid.aquifer.synchronizer.security.config.SecurityConfig} checks per endpoint.
 */
public class TokenAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(TokenAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final ApiTokenProperties tokenProperties;

    public TokenAuthenticationFilter(ApiTokenProperties tokenProperties) {
        this.tokenProperties = tokenProperties;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return PublicPaths.isPublic(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        Optional<ApiToken> token = header == null || header.isBlank()
                ? Optional.empty()
                : tokenProperties.find(stripBearer(header.trim()));

        if (token.isEmpty()) {
            logger.warn("Rejected request to {} from {}", request.getRequestURI(), request.getRemoteAddr());
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.getWriter().write("{\"error\": \"Invalid or missing token\"}");
            return;
        }

        ApiToken apiToken = token.get();
        List<SimpleGrantedAuthority> authorities = apiToken.scopes().stream()
                .map(scope -> new SimpleGrantedAuthority(scope.authority()))
                .toList();
        logger.debug("Token '{}' authenticated for {} with {}", apiToken.name(), request.getRequestURI(), authorities);

        UsernamePasswordAuthenticationToken authenticationToken =
                new UsernamePasswordAuthenticationToken(apiToken.name(), null, authorities);
        authenticationToken.setDetails(
                new WebAuthenticationDetailsSource().buildDetails(request));

        SecurityContextHolder.getContext().setAuthentication(authenticationToken);

        try {
            filterChain.doFilter(request, response);
        } finally {
            SecurityContextHolder.clearContext();
        }
    }

    private static String stripBearer(String header) {
        return header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())
                ? header.substring(BEARER_PREFIX.length()).trim()
                : header;
    }
}

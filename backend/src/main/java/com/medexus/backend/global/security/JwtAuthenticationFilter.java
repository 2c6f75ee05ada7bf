package com.medexus.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.medexus.backend.modules.auth.application.JwtTokenService;
import com.medexus.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.medexus.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.medexus.backend.modules.auth.domain.MarketUser;
import com.medexus.backend.modules.auth.infrastructure.persistence.MarketUserRepository;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String AUTH_ERROR_ATTRIBUTE = "medexus.auth.error";
    public static final String INVALID_ACCESS_TOKEN = "INVALID_ACCESS_TOKEN";
    public static final String USER_NOT_FOUND = "USER_NOT_FOUND";

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenService jwtTokenService;
    private final MarketUserRepository marketUserRepository;

    public JwtAuthenticationFilter(JwtTokenService jwtTokenService, MarketUserRepository marketUserRepository) {
        this.jwtTokenService = jwtTokenService;
        this.marketUserRepository = marketUserRepository;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length());
            try {
                ParsedToken parsed = jwtTokenService.parseAccessToken(token);
                Optional<MarketUser> account = marketUserRepository.findById(parsed.userId());
                if (account.isEmpty()) {
                    // signature is valid but the account has been removed since issue
                    log.debug("Bearer token for missing account {}", parsed.userId());
                    SecurityContextHolder.clearContext();
                    request.setAttribute(AUTH_ERROR_ATTRIBUTE, USER_NOT_FOUND);
                    filterChain.doFilter(request, response);
                    return;
                }
                MarketUser user = account.get();
                List<SimpleGrantedAuthority> authorities =
                        List.of(new SimpleGrantedAuthority("ROLE_" + user.getRole().name()));

                JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(
                        user.getId(),
                        user.getEmail(),
                        user.getRole()
                );

                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, token, authorities);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (InvalidTokenException ex) {
                // the entry point answers 401 once the chain reaches a protected route
                log.debug("Rejected bearer token: {}", ex.getMessage());
                SecurityContextHolder.clearContext();
                request.setAttribute(AUTH_ERROR_ATTRIBUTE, INVALID_ACCESS_TOKEN);
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return path.equals("/auth/signup") || path.equals("/auth/login")
                || path.startsWith("/health") || path.startsWith("/actuator");
    }
}

package com.omniguard.api.config;

import com.omniguard.core.domain.Identity;
import com.omniguard.core.domain.Tier;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Builds the authenticated {@link Identity} from headers set by the upstream auth gateway.
 * <p>
 * {@code X-Identity-Roles} may carry {@code OPERATOR} for audit and key administration.
 */
public class IdentityHeaderFilter extends OncePerRequestFilter {

    public static final String IDENTITY_HEADER = "X-Identity-Id";
    public static final String TIER_HEADER = "X-Identity-Tier";
    public static final String ROLES_HEADER = "X-Identity-Roles";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String identityId = request.getHeader(IDENTITY_HEADER);
        if (identityId != null && !identityId.isBlank()) {
            Identity identity = Identity.of(identityId.trim(), Tier.fromName(request.getHeader(TIER_HEADER)));
            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(identity, null, authorities(request.getHeader(ROLES_HEADER)));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        }
        chain.doFilter(request, response);
    }

    private static List<GrantedAuthority> authorities(String rolesHeader) {
        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority("ROLE_USER"));
        if (rolesHeader != null) {
            Arrays.stream(rolesHeader.split(","))
                    .map(String::trim)
                    .filter(role -> !role.isEmpty())
                    .map(role -> new SimpleGrantedAuthority("ROLE_" + role.toUpperCase(Locale.ROOT)))
                    .forEach(authorities::add);
        }
        return authorities;
    }
}

package io.b2mash.readiness.scope;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the calling member from the {@code X-Member-Id} header supplied by the upstream
 * authentication layer and binds their {@link AccessScope} to the request. Requests without a
 * resolvable member continue unbound; endpoints that need a caller reject them with 401.
 */
@Component
public class CallerFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(CallerFilter.class);

  public static final String MEMBER_HEADER = "X-Member-Id";

  private final AccessScopeResolver accessScopeResolver;

  public CallerFilter(AccessScopeResolver accessScopeResolver) {
    this.accessScopeResolver = accessScopeResolver;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String header = request.getHeader(MEMBER_HEADER);
    if (header != null && !header.isBlank()) {
      try {
        var memberId = UUID.fromString(header.trim());
        accessScopeResolver
            .resolve(memberId)
            .ifPresent(scope -> request.setAttribute(RequestScopes.SCOPE_ATTRIBUTE, scope));
      } catch (IllegalArgumentException e) {
        log.debug("Ignoring malformed {} header: {}", MEMBER_HEADER, header);
      }
    }
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith("/api/");
  }
}

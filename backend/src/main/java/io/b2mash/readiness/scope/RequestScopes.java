package io.b2mash.readiness.scope;

import io.b2mash.readiness.exception.MissingCallerException;
import java.util.Optional;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;

/**
 * Request-bound caller scope. Bound by {@link CallerFilter}, read by controllers which hand it to
 * services explicitly.
 */
public final class RequestScopes {

  static final String SCOPE_ATTRIBUTE = RequestScopes.class.getName() + ".SCOPE";

  /** Returns the caller's scope. Throws if the filter could not resolve an active member. */
  public static AccessScope requireScope() {
    return currentScope()
        .orElseThrow(
            () ->
                new MissingCallerException(
                    "Header " + CallerFilter.MEMBER_HEADER + " must identify an active member"));
  }

  /** The caller's scope if this thread is serving a request with a resolved caller. */
  public static Optional<AccessScope> currentScope() {
    var attributes = RequestContextHolder.getRequestAttributes();
    Object scope =
        attributes != null
            ? attributes.getAttribute(SCOPE_ATTRIBUTE, RequestAttributes.SCOPE_REQUEST)
            : null;
    return scope instanceof AccessScope accessScope ? Optional.of(accessScope) : Optional.empty();
  }

  private RequestScopes() {}
}

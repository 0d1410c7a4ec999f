package tech.yump.wrapper.api;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Assigns every request its correlation reference ({@code ref} in response bodies).
 * A well-formed {@value #REQUEST_ID_HEADER} supplied by the fronting platform is reused;
 * otherwise a random UUID is generated. The reference is echoed in the response header
 * and kept in the logging MDC for the duration of the request.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

  public static final String REQUEST_ID_HEADER = "X-Request-Id";
  public static final String REQUEST_REF_ATTR = "wrapperRequestRef";
  public static final String MDC_REQUEST_ID_KEY = "requestId";

  private static final Pattern ACCEPTED_REF = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

  /**
   * Returns the reference assigned to {@code request}, or a fresh one if the filter did not run.
   */
  public static String currentRef(HttpServletRequest request) {
    Object ref = request.getAttribute(REQUEST_REF_ATTR);
    return ref instanceof String s ? s : UUID.randomUUID().toString();
  }

  @Override
  protected void doFilterInternal(
          @NonNull HttpServletRequest request,
          @NonNull HttpServletResponse response,
          @NonNull FilterChain filterChain) throws ServletException, IOException {

    String ref = resolveRef(request.getHeader(REQUEST_ID_HEADER));
    request.setAttribute(REQUEST_REF_ATTR, ref);
    response.setHeader(REQUEST_ID_HEADER, ref);

    MDC.put(MDC_REQUEST_ID_KEY, ref);
    try {
      filterChain.doFilter(request, response);
    } finally {
      MDC.remove(MDC_REQUEST_ID_KEY);
    }
  }

  static String resolveRef(String header) {
    if (header != null) {
      String candidate = header.trim();
      if (ACCEPTED_REF.matcher(candidate).matches()) {
        return candidate;
      }
      log.debug("Ignoring malformed {} header", REQUEST_ID_HEADER);
    }
    return UUID.randomUUID().toString();
  }
}

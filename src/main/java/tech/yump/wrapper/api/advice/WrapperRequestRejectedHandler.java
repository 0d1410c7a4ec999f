package tech.yump.wrapper.api.advice;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.web.firewall.RequestRejectedException;
import org.springframework.security.web.firewall.RequestRejectedHandler;
import org.springframework.stereotype.Component;
import tech.yump.wrapper.api.RequestCorrelationFilter;
import tech.yump.wrapper.api.dto.WrapperResponse;
import tech.yump.wrapper.validation.Validated;
import tech.yump.wrapper.validation.WrapperValidator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Answers requests refused by the Spring Security firewall (encoded slashes, semicolons and
 * similar) with the usual envelope instead of a bare 400.
 * <p>
 * An unwrap path is reported the way the controller reports a bad id: HTTP 200 with a field
 * error on {@code id}. Anything else keeps its 400 status.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WrapperRequestRejectedHandler implements RequestRejectedHandler {

    static final String UNWRAP_PATH_PREFIX = "/v1/wrapper/";
    static final String BAD_REQUEST_MESSAGE = "bad request";

    private final WrapperValidator validator;
    private final ObjectMapper objectMapper;

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       RequestRejectedException requestRejectedException) throws IOException {
        String ref = RequestCorrelationFilter.currentRef(request);
        String path = request.getRequestURI().substring(request.getContextPath().length());

        Validated<String> id = path.startsWith(UNWRAP_PATH_PREFIX)
                ? validator.validateId(path.substring(UNWRAP_PATH_PREFIX.length()))
                : null;

        WrapperResponse<Void> body;
        if (id != null && !id.isValid()) {
            log.info("Unwrap request rejected by firewall: {}", id.errors());
            body = WrapperResponse.failed(id.errors(), ref);
            response.setStatus(HttpStatus.OK.value());
        } else {
            log.info("Request rejected by firewall: {}", requestRejectedException.getMessage());
            body = WrapperResponse.failed(BAD_REQUEST_MESSAGE, ref);
            response.setStatus(HttpStatus.BAD_REQUEST.value());
        }

        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}

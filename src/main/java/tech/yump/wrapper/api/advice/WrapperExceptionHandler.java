package tech.yump.wrapper.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.wrapper.api.RequestCorrelationFilter;
import tech.yump.wrapper.api.dto.WrapperResponse;
import tech.yump.wrapper.validation.FieldError;

import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Outermost error boundary. Nothing escapes as a platform error page: every fault becomes a
 * {@link WrapperResponse} with status "failed".
 * <ul>
 *   <li>Unreadable JSON bodies are reported as a field error on {@code body}, HTTP 200.</li>
 *   <li>Store failures and any unexpected exception become "internal error", HTTP 200; the
 *       detail is only logged.</li>
 *   <li>Routing failures (unknown path, wrong method or media type) keep their HTTP status
 *       but still carry the envelope.</li>
 * </ul>
 */
@RestControllerAdvice
@Slf4j
public class WrapperExceptionHandler extends ResponseEntityExceptionHandler {

    public static final String INTERNAL_ERROR_MESSAGE = "internal error";
    static final String MALFORMED_BODY_MESSAGE = "malformed JSON body";

    private static final Pattern WRAPPER_ID_IN_PATH = Pattern.compile("(/v1/wrapper/[^/?]{0,4})[^/?]*");

    @ExceptionHandler(Exception.class)
    public ResponseEntity<WrapperResponse<Void>> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("internal error: {}, {}. Request: {} {}",
                ex.getClass().getName(), ex.getMessage(), request.getMethod(), redactWrapperId(request.getRequestURI()), ex);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(WrapperResponse.failed(INTERNAL_ERROR_MESSAGE, RequestCorrelationFilter.currentRef(request)));
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode status, @NonNull WebRequest request) {

        log.info("Rejected unreadable request body. Request: {}. Details: {}",
                redactWrapperId(request.getDescription(false)), ex.getMessage());

        List<FieldError> errors = List.of(FieldError.of("body", MALFORMED_BODY_MESSAGE, FieldError.TYPE_JSON));
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(WrapperResponse.failed(errors, refOf(request)));
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(
            @NonNull Exception ex, @Nullable Object body, @NonNull HttpHeaders headers,
            @NonNull HttpStatusCode statusCode, @NonNull WebRequest request) {

        String reason = statusCode instanceof HttpStatus httpStatus
                ? httpStatus.getReasonPhrase().toLowerCase(Locale.ROOT)
                : "request failed";
        HttpStatusCode responseStatus = statusCode;
        if (statusCode.is5xxServerError()) {
            log.error("internal error: {}, {}. Request: {}",
                    ex.getClass().getName(), ex.getMessage(), redactWrapperId(request.getDescription(false)), ex);
            reason = INTERNAL_ERROR_MESSAGE;
            responseStatus = HttpStatus.OK;
        } else {
            log.info("Request failed with {}: {}. Request: {}",
                    statusCode.value(), redactWrapperId(ex.getMessage()), redactWrapperId(request.getDescription(false)));
        }

        HttpHeaders responseHeaders = new HttpHeaders();
        responseHeaders.addAll(headers);
        responseHeaders.setContentType(MediaType.APPLICATION_JSON);
        return new ResponseEntity<>(WrapperResponse.failed(reason, refOf(request)), responseHeaders, responseStatus);
    }

    /**
     * A failed unwrap may leave the record in place, so only a short prefix of its id is logged.
     */
    static String redactWrapperId(@Nullable String text) {
        return text == null ? null : WRAPPER_ID_IN_PATH.matcher(text).replaceAll("$1***");
    }

    private static String refOf(WebRequest request) {
        if (request instanceof ServletWebRequest servletWebRequest) {
            return RequestCorrelationFilter.currentRef(servletWebRequest.getRequest());
        }
        return UUID.randomUUID().toString();
    }
}

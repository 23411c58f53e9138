package com.example.connect.common.error;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.error.ErrorAttributeOptions;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Renders errors that escape the controllers as {@link ErrorResponse} JSON.
 * Expected failures are returned as values by the controllers; this covers the rest.
 */
@Slf4j
@Component
@Order(-2)  // Higher priority than DefaultErrorWebExceptionHandler
public class GlobalErrorWebExceptionHandler extends AbstractErrorWebExceptionHandler {

    public GlobalErrorWebExceptionHandler(
            ErrorAttributes errorAttributes,
            WebProperties webProperties,
            ApplicationContext applicationContext,
            ServerCodecConfigurer serverCodecConfigurer) {
        super(errorAttributes, webProperties.getResources(), applicationContext);
        this.setMessageWriters(serverCodecConfigurer.getWriters());
    }

    @Override
    protected RouterFunction<ServerResponse> getRoutingFunction(ErrorAttributes errorAttributes) {
        return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
    }

    private Mono<ServerResponse> renderErrorResponse(ServerRequest request) {
        Throwable error = getError(request);
        String path = request.path();

        if (error instanceof OAuthException oauthError) {
            log.warn("OAuth error: path={}, type={}, message={}",
                    path, oauthError.getType(), oauthError.getMessage());
            return render(ErrorResponse.of(oauthError.getError(), path));
        }

        if (error instanceof ResponseStatusException statusException) {
            HttpStatus status = HttpStatus.resolve(statusException.getStatusCode().value());
            if (status == null) {
                status = HttpStatus.INTERNAL_SERVER_ERROR;
            }
            log.warn("Response status exception: path={}, status={}, reason={}",
                    path, status, statusException.getReason());
            return render(ErrorResponse.of(status.value(), "request_error",
                    statusException.getReason() != null ? statusException.getReason() : status.getReasonPhrase(),
                    path));
        }

        if (error instanceof IllegalArgumentException) {
            log.warn("Invalid argument: path={}, error={}", path, error.getMessage());
            return render(ErrorResponse.of(HttpStatus.BAD_REQUEST.value(), "invalid_argument",
                    "Invalid request parameter", path));
        }

        Map<String, Object> errorAttributes = getErrorAttributes(request, ErrorAttributeOptions.defaults());
        int status = (int) errorAttributes.getOrDefault("status", 500);

        log.error("Unhandled error: path={}, status={}, error={}",
                path, status, error.getMessage(), error);

        return render(ErrorResponse.of(status, "server_error", "An unexpected error occurred", path));
    }

    private Mono<ServerResponse> render(ErrorResponse body) {
        return ServerResponse.status(body.status())
                .contentType(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromValue(body));
    }
}

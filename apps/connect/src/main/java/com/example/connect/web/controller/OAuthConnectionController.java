package com.example.connect.web.controller;

import com.example.connect.common.error.ErrorResponse;
import com.example.connect.common.error.OAuthError;
import com.example.connect.common.error.OAuthErrorType;
import com.example.connect.common.error.OAuthResult;
import com.example.connect.common.util.StringSanitizer;
import com.example.connect.credential.service.ConnectionService;
import com.example.connect.flow.service.FlowOrchestrator;
import com.example.connect.provider.model.ProviderDescriptor;
import com.example.connect.provider.model.ProviderStatus;
import com.example.connect.provider.service.ProviderRegistry;
import com.example.connect.session.SessionCredentials;
import com.example.connect.session.SessionVerifier;
import com.example.connect.web.dto.ConnectionResponse;
import com.example.connect.web.dto.ProvidersResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/oauth")
@RequiredArgsConstructor
public class OAuthConnectionController {

    private final FlowOrchestrator flowOrchestrator;
    private final ConnectionService connectionService;
    private final ProviderRegistry providerRegistry;
    private final SessionVerifier sessionVerifier;

    /**
     * Redirects the signed-in user to the provider's consent page.
     */
    @GetMapping("/connect/{provider}")
    public Mono<ResponseEntity<Object>> connect(@PathVariable String provider, ServerWebExchange exchange) {
        OAuthResult<ProviderDescriptor> resolved = providerRegistry.resolve(provider);
        if (resolved.isFailure()) {
            return Mono.just(error(resolved.error(), exchange));
        }

        return authenticate(exchange)
                .flatMap(userId -> flowOrchestrator.begin(userId, provider))
                .map(result -> result.isSuccess()
                        ? ResponseEntity.status(HttpStatus.FOUND).location(URI.create(result.value())).<Object>build()
                        : error(result.error(), exchange))
                .switchIfEmpty(Mono.fromSupplier(() -> unauthorized(exchange)));
    }

    /**
     * Provider redirect target. No session is required: the state token identifies the user.
     */
    @GetMapping("/callback/{provider}")
    public Mono<ResponseEntity<Object>> callback(
            @PathVariable String provider,
            @RequestParam(required = false) @Nullable String code,
            @RequestParam(required = false) @Nullable String state,
            @RequestParam(name = "error", required = false) @Nullable String providerError,
            @RequestParam(name = "error_description", required = false) @Nullable String errorDescription,
            ServerWebExchange exchange) {

        if (providerError != null) {
            // the unredeemed state expires on its own
            log.warn("Provider {} returned authorization error: {}",
                    StringSanitizer.forLog(provider), StringSanitizer.forLog(providerError));
            return Mono.just(error(OAuthError.upstream(OAuthErrorType.EXCHANGE_FAILED,
                    "Authorization was not granted", null,
                    StringSanitizer.forLog(errorDescription != null ? errorDescription : providerError, 256)),
                    exchange));
        }

        return flowOrchestrator.complete(provider, code, state)
                .map(result -> {
                    if (result.isFailure()) {
                        return error(result.error(), exchange);
                    }
                    String displayName = providerRegistry.resolve(provider)
                            .map(ProviderDescriptor::displayName)
                            .value();
                    return ResponseEntity.ok((Object) ConnectionResponse.connected(provider,
                            displayName != null ? displayName : provider));
                });
    }

    @GetMapping("/providers")
    public Mono<ResponseEntity<Object>> listConnected(ServerWebExchange exchange) {
        return authenticate(exchange)
                .flatMap(connectionService::listConnected)
                .map(result -> result.isSuccess()
                        ? ResponseEntity.ok((Object) new ProvidersResponse<>(result.value()))
                        : error(result.error(), exchange))
                .switchIfEmpty(Mono.fromSupplier(() -> unauthorized(exchange)));
    }

    @DeleteMapping("/providers/{provider}")
    public Mono<ResponseEntity<Object>> disconnect(@PathVariable String provider, ServerWebExchange exchange) {
        return authenticate(exchange)
                .flatMap(userId -> connectionService.disconnect(userId, provider))
                .map(result -> result.isSuccess()
                        ? ResponseEntity.ok((Object) ConnectionResponse.disconnected(result.value()))
                        : error(result.error(), exchange))
                .switchIfEmpty(Mono.fromSupplier(() -> unauthorized(exchange)));
    }

    @GetMapping("/catalog")
    public ResponseEntity<ProvidersResponse<ProviderStatus>> catalog() {
        List<ProviderStatus> statuses = providerRegistry.catalog();
        return ResponseEntity.ok(new ProvidersResponse<>(statuses));
    }

    private Mono<String> authenticate(ServerWebExchange exchange) {
        return SessionCredentials.extract(exchange.getRequest())
                .map(sessionVerifier::verify)
                .orElseGet(Mono::empty);
    }

    private ResponseEntity<Object> unauthorized(ServerWebExchange exchange) {
        return error(OAuthError.of(OAuthErrorType.INVALID_SESSION, "Invalid or expired session"), exchange);
    }

    private ResponseEntity<Object> error(OAuthError error, ServerWebExchange exchange) {
        return ResponseEntity.status(error.type().httpStatus())
                .body(ErrorResponse.of(error, exchange.getRequest().getPath().value()));
    }
}

package com.example.osr.infrastructure.adapter.out.osr;

import com.example.osr.application.exception.NonRetryableTransportException;
import com.example.osr.application.exception.RetryableTransportException;
import com.example.osr.application.exception.TransportException;
import com.example.osr.application.port.out.OsrTransportPort;
import com.example.osr.domain.document.OrderDocument;
import com.example.osr.infrastructure.adapter.out.osr.dto.OrderReceiptResponse;
import com.example.osr.infrastructure.adapter.out.osr.dto.OrderStatusResponse;
import com.example.osr.infrastructure.adapter.out.osr.dto.ServicePortResponse;
import com.example.osr.infrastructure.adapter.out.osr.mapper.OsrReplyMapper;
import com.example.osr.infrastructure.config.OsrProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Adapter for the HTTP gateway in front of the OSR host interface.
 * The host interface endpoint is looked up through the gateway's naming service on first use
 * and cached until a transient failure suggests it has moved.
 * Calls are never retried here.
 */
@Component
public class OsrTransportAdapter implements OsrTransportPort {

    private static final Logger log = LoggerFactory.getLogger(OsrTransportAdapter.class);

    static final String RESOLVE = "resolve";
    static final String SEND = "send";
    static final String CANCEL = "cancel";
    static final String STATUS = "status";

    private static final int MAX_BODY_IN_MESSAGE = 200;

    private final WebClient webClient;
    private final OsrReplyMapper mapper;
    private final String osrId;
    private final AtomicReference<String> session = new AtomicReference<>();

    public OsrTransportAdapter(
            @Qualifier("osrWebClient") WebClient webClient,
            OsrReplyMapper mapper,
            OsrProperties properties) {
        this.webClient = webClient;
        this.mapper = mapper;
        this.osrId = properties.osrId();
    }

    @Override
    public RemoteReference send(OrderDocument document, Duration timeout) {
        if (!document.isFinalized()) {
            throw new IllegalArgumentException("Only finalized documents can be sent");
        }
        log.debug("Sending {} order {} to OSR {}", document.getKind(), document.getOrderNumber(), osrId);

        OrderReceiptResponse receipt = invoke(SEND, timeout, endpoint -> webClient.post()
                .uri(endpoint + "/orders")
                .contentType(MediaType.APPLICATION_XML)
                .bodyValue(document.toXml())
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> failure(SEND, response))
                .bodyToMono(OrderReceiptResponse.class));
        return mapper.toReference(SEND, receipt);
    }

    @Override
    public CancellationAck cancel(RemoteReference reference, Duration timeout) {
        log.debug("Cancelling OSR order {}", reference.value());

        invoke(CANCEL, timeout, endpoint -> webClient.post()
                .uri(endpoint + "/orders/{reference}/cancel", reference.value())
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> failure(CANCEL, response))
                .toBodilessEntity());
        return new CancellationAck(reference);
    }

    @Override
    public RemoteStatus queryStatus(RemoteReference reference, Duration timeout) {
        log.debug("Querying status of OSR order {}", reference.value());

        OrderStatusResponse status = invoke(STATUS, timeout, endpoint -> webClient.get()
                .uri(endpoint + "/orders/{reference}/status", reference.value())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> failure(STATUS, response))
                .bodyToMono(OrderStatusResponse.class));
        return mapper.toStatus(STATUS, status);
    }

    private <T> T invoke(String operation, Duration timeout, Function<String, Mono<T>> call) {
        String endpoint = resolveSession(timeout);
        try {
            return call.apply(endpoint).timeout(timeout).block();
        } catch (RuntimeException e) {
            TransportException failure = classify(operation, timeout, e);
            if (failure.isTransient() && session.compareAndSet(endpoint, null)) {
                log.info("Dropped OSR {} session {} after {} failure", osrId, endpoint, operation);
            }
            throw failure;
        }
    }

    private String resolveSession(Duration timeout) {
        String current = session.get();
        if (current != null) {
            return current;
        }

        ServicePortResponse reply;
        try {
            reply = webClient.get()
                    .uri("/naming/{osrId}/service-ports/hio", osrId)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> failure(RESOLVE, response))
                    .bodyToMono(ServicePortResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (RuntimeException e) {
            throw classify(RESOLVE, timeout, e);
        }

        String endpoint = mapper.toEndpoint(RESOLVE, reply);
        session.set(endpoint);
        log.info("Resolved OSR {} host interface at {}", osrId, endpoint);
        return endpoint;
    }

    private static Mono<Throwable> failure(String operation, ClientResponse response) {
        int statusCode = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMap(body -> Mono.error(statusFailure(operation, statusCode, body)));
    }

    static TransportException statusFailure(String operation, int statusCode, String body) {
        String message = "OSR gateway returned " + statusCode + " on " + operation + abbreviate(body);
        if (statusCode >= 500 || statusCode == 429 || statusCode == 408) {
            return new RetryableTransportException(operation, statusCode, message);
        }
        return new NonRetryableTransportException(operation, statusCode, message);
    }

    private static TransportException classify(String operation, Duration timeout, RuntimeException e) {
        Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof TransportException transportException) {
            return transportException;
        }
        if (cause instanceof TimeoutException) {
            return new RetryableTransportException(operation,
                    "OSR did not answer " + operation + " within " + timeout.toMillis() + "ms", cause);
        }
        if (cause instanceof WebClientRequestException) {
            return new RetryableTransportException(operation,
                    "Cannot reach OSR gateway: " + cause.getMessage(), cause);
        }
        if (cause instanceof WebClientResponseException responseException) {
            return statusFailure(operation, responseException.getStatusCode().value(),
                    responseException.getResponseBodyAsString());
        }
        return new NonRetryableTransportException(operation, 0,
                "Malformed OSR reply on " + operation + ": " + cause.getMessage(), cause);
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        return ": " + (trimmed.length() > MAX_BODY_IN_MESSAGE
                ? trimmed.substring(0, MAX_BODY_IN_MESSAGE) + "..."
                : trimmed);
    }
}

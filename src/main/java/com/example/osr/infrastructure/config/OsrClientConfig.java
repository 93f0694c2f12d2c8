package com.example.osr.infrastructure.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Configuration for the WebClient talking to the OSR gateway.
 * Per-call timeouts are applied by the transport adapter; the client only bounds connect and write time.
 */
@Configuration
public class OsrClientConfig {

    @Bean
    public WebClient osrWebClient(WebClient.Builder builder, OsrProperties properties) {
        OsrProperties.Gateway gateway = properties.gateway();
        long writeTimeoutMs = gateway.callTimeout().toMillis();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) gateway.connectTimeout().toMillis())
                .doOnConnected(conn -> conn
                        .addHandlerLast(new WriteTimeoutHandler(writeTimeoutMs, TimeUnit.MILLISECONDS)));

        return builder
                .baseUrl(gateway.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}

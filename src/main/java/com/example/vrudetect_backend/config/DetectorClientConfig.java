package com.example.vrudetect_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(DetectorProperties.class)
public class DetectorClientConfig {

    @Bean("detectorWebClient")
    public WebClient detectorWebClient(DetectorProperties props) {
        var to = Duration.ofSeconds(Math.max(1, props.getTimeoutSeconds()));

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(c -> c.defaultCodecs().maxInMemorySize(8 * 1024 * 1024))
                .build();

        HttpClient http = HttpClient.create()
                .responseTimeout(to)
                .option(io.netty.channel.ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new io.netty.handler.timeout.ReadTimeoutHandler((int) to.getSeconds()))
                        .addHandlerLast(new io.netty.handler.timeout.WriteTimeoutHandler((int) to.getSeconds()))
                );

        return WebClient.builder()
                .baseUrl(props.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(http))
                .exchangeStrategies(strategies)
                .build();
    }
}

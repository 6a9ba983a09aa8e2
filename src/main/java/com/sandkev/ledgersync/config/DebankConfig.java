package com.sandkev.ledgersync.config;

import com.sandkev.ledgersync.fetch.DebankClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(DebankProperties.class)
public class DebankConfig {

    @Bean
    WebClient debankWebClient(DebankProperties p) {
        var http = HttpClient.create()
                .responseTimeout(Duration.ofMillis(p.timeoutMs()))
                .compress(true);

        var builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(http))
                .baseUrl(p.baseUrl())
                .defaultHeader("User-Agent", p.userAgent())
                // history pages with many legs exceed the 256k default
                .codecs(c -> c.defaultCodecs().maxInMemorySize(8 * 1024 * 1024));

        if (p.configured()) {
            builder.defaultHeader(p.apiKeyHeader(), p.apiKey());
        }
        return builder.build();
    }

    @Bean
    DebankClient debankClient(WebClient debankWebClient) {
        return new DebankClient(debankWebClient);
    }
}

package sp.sistemaspalacios.api_hermes.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class RestTemplateConfig {

    // Despachador, gateway push y asistencia comparten el mismo cliente
    @Bean
    public RestTemplate restTemplate(
            RestTemplateBuilder builder,
            @Value("${hermes.http.connect-timeout-ms:5000}") long connectTimeoutMs,
            @Value("${hermes.http.read-timeout-ms:10000}") long readTimeoutMs
    ) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }
}

package ru.uzden.vpnpanel.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;


@Configuration
public class RestClientConfig {

    /**
     * Общий builder для клиентов панелей. Таймауты задаются здесь, каждый клиент панели
     * делает clone() и подставляет свой baseUrl.
     */
    @Bean
    public RestClient.Builder panelRestClientBuilder(PanelProperties props) {
        SimpleClientHttpRequestFactory rf = new SimpleClientHttpRequestFactory();
        rf.setConnectTimeout((int) props.http().connectTimeout().toMillis());
        rf.setReadTimeout((int) props.http().readTimeout().toMillis());
        return RestClient.builder().requestFactory(rf);
    }

    /**
     * Instant в ответах admin API - строкой ISO-8601.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .findAndRegisterModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}

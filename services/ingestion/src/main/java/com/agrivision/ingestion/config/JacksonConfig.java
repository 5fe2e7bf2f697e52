package com.agrivision.ingestion.config;

import com.agrivision.common.util.JsonUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/**
 * Jackson and codec configuration. Readings embed a base64 camera frame, so the JSON decoder
 * must buffer bodies well above the WebFlux default of 256 KB.
 */
@Configuration
public class JacksonConfig implements WebFluxConfigurer {

    private final DataSize maxBodySize;

    public JacksonConfig(@Value("${spring.codec.max-in-memory-size:15MB}") DataSize maxBodySize) {
        this.maxBodySize = maxBodySize;
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return JsonUtil.getObjectMapper();
    }

    @Override
    public void configureHttpMessageCodecs(ServerCodecConfigurer configurer) {
        ObjectMapper mapper = objectMapper();
        int limit = Math.toIntExact(maxBodySize.toBytes());

        Jackson2JsonDecoder decoder = new Jackson2JsonDecoder(mapper);
        decoder.setMaxInMemorySize(limit);

        configurer.defaultCodecs().maxInMemorySize(limit);
        configurer.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper));
        configurer.defaultCodecs().jackson2JsonDecoder(decoder);
    }
}

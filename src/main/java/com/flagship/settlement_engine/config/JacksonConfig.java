package com.flagship.settlement_engine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.math.BigInteger;

/**
 * Jackson configuration for API responses and outbox payloads.
 *
 * - Instants as ISO-8601 strings
 * - 256-bit integers as decimal strings, since JSON numbers lose precision
 *   past 2^53 in most consumers. Both numbers and strings are accepted on input.
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        SimpleModule uint256 = new SimpleModule("uint256-as-string");
        uint256.addSerializer(BigInteger.class, ToStringSerializer.instance);
        mapper.registerModule(uint256);

        return mapper;
    }
}

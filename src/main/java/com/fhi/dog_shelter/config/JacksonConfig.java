package com.fhi.dog_shelter.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig
{
   /**
    * The application-wide {@link ObjectMapper}, used for HTTP responses and for reading
    * JSON fixtures in tests:
    * - JSON comments allowed (fixtures carry them)
    * - unknown properties ignored (e.g. "_comment" fields)
    * - java.time values written as ISO-8601 strings
    */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(JsonParser.Feature.ALLOW_COMMENTS, true)                       // // and /* */ comments in JSON
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)     // allows _comment fields etc.
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);                // "2025-07-15T10:00:00Z", not 1752573600.000
    }
}

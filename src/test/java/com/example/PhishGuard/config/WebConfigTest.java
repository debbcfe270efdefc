package com.example.PhishGuard.config;

import com.example.PhishGuard.controllers.HealthCheck;
import com.example.PhishGuard.service.ClassificationEngine;
import com.example.PhishGuard.service.RateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("CORS")
class WebConfigTest {

    @Test
    @DisplayName("Wildcard origins never allow credentials")
    void wildcardWithoutCredentials() {
        assertThat(new WebConfig(new String[]{"*"}).hasExplicitOrigins()).isFalse();
        assertThat(new WebConfig(new String[]{"https://*.example.com"}).hasExplicitOrigins()).isFalse();
        assertThat(new WebConfig(new String[]{"https://dashboard.example.com"}).hasExplicitOrigins()).isTrue();
    }

    @Nested
    @WebMvcTest(HealthCheck.class)
    @Import(RateLimiter.class)
    @DisplayName("with the default wildcard origin")
    class DefaultOrigins {

        @Autowired
        private MockMvc mockMvc;

        @MockBean
        private ClassificationEngine classificationEngine;

        @Test
        @DisplayName("Preflight from any origin is answered without credentials")
        void preflightWithoutCredentials() throws Exception {
            mockMvc.perform(options("/health")
                            .header("Origin", "https://attacker.example")
                            .header("Access-Control-Request-Method", "GET"))
                    .andExpect(status().isOk())
                    .andExpect(header().doesNotExist("Access-Control-Allow-Credentials"));
        }
    }

    @Nested
    @WebMvcTest(HealthCheck.class)
    @Import(RateLimiter.class)
    @TestPropertySource(properties = "CORS_ORIGINS=https://dashboard.example.com")
    @DisplayName("with an explicit origin list")
    class ExplicitOrigins {

        @Autowired
        private MockMvc mockMvc;

        @MockBean
        private ClassificationEngine classificationEngine;

        @Test
        @DisplayName("Listed origin gets credentials")
        void listedOrigin() throws Exception {
            mockMvc.perform(options("/health")
                            .header("Origin", "https://dashboard.example.com")
                            .header("Access-Control-Request-Method", "GET"))
                    .andExpect(status().isOk())
                    .andExpect(header().string("Access-Control-Allow-Origin", "https://dashboard.example.com"))
                    .andExpect(header().string("Access-Control-Allow-Credentials", "true"));
        }

        @Test
        @DisplayName("Unlisted origin is refused")
        void unlistedOrigin() throws Exception {
            mockMvc.perform(options("/health")
                            .header("Origin", "https://attacker.example")
                            .header("Access-Control-Request-Method", "GET"))
                    .andExpect(status().isForbidden());
        }
    }
}

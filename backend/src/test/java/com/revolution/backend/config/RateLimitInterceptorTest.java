package com.revolution.backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "revolution.rate-limit.throttle.limit-per-minute=2",
        "revolution.rate-limit.throttle.timeout-ms=0"
})
@AutoConfigureMockMvc
class RateLimitInterceptorTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void refreshIsThrottledPerClientAddress() throws Exception {
        mockMvc.perform(refreshFrom("192.0.2.10"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("X-RateLimit-Limit", "2"));
        mockMvc.perform(refreshFrom("192.0.2.10"))
                .andExpect(status().isUnauthorized());

        mockMvc.perform(refreshFrom("192.0.2.10"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.status").value(429))
                .andExpect(jsonPath("$.error").value("TOO_MANY_REQUESTS"))
                .andExpect(jsonPath("$.message").value("Rate limit exceeded"));

        mockMvc.perform(refreshFrom("192.0.2.11"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void readsAreNotThrottled() throws Exception {
        for (int i = 0; i < 4; i++) {
            mockMvc.perform(get("/api/auth/me").with(request -> {
                        request.setRemoteAddr("192.0.2.20");
                        return request;
                    }))
                    .andExpect(status().isUnauthorized());
        }
    }

    private static MockHttpServletRequestBuilder refreshFrom(String clientIp) {
        return post("/api/auth/refresh")
                .with(request -> {
                    request.setRemoteAddr(clientIp);
                    return request;
                })
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"refresh_token\":\"not.a.token\"}");
    }
}

package com.github.dimitryivaniuta.metergateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.metergateway.gateway.GatewayFacade;
import com.github.dimitryivaniuta.metergateway.gateway.portal.PortalClient;
import com.github.dimitryivaniuta.metergateway.gateway.portal.PortalLoginException;
import com.github.dimitryivaniuta.metergateway.infra.BaseIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.MOCK)
@AutoConfigureMockMvc
@Import(GatewayApplicationIT.FakePortal.class)
class GatewayApplicationIT extends BaseIntegrationTest {

    @TestConfiguration
    static class FakePortal {
        @Bean
        @Primary
        PortalClient fakePortalClient() {
            return (username, password) -> "demo-pass".equals(password)
                    ? CompletableFuture.completedFuture(null)
                    : CompletableFuture.failedFuture(new PortalLoginException("Invalid username or password"));
        }
    }

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper om;
    @Autowired GatewayFacade facade;

    @Test
    void login_thenVerify_shouldRoundTripPrincipal() throws Exception {
        String token = login("acct-" + System.nanoTime());

        mvc.perform(get("/auth/verify").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(header().exists("X-RateLimit-Remaining"));
    }

    @Test
    void login_withWrongPassword_shouldBe401() throws Exception {
        mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"username":"acct-1","password":"nope"}
                                """))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error_code").value("AUTHENTICATION_FAILED"));
    }

    @Test
    void cached_shouldPersistThroughDatabaseAndInvalidateByPattern() throws Exception {
        String token = login("acct-" + System.nanoTime());
        Double value = facade.cached("meter:42:unit", Double.class, () -> 17.5);
        facade.cached("meter:7:unit", Double.class, () -> 9.0);

        assertThat(value).isEqualTo(17.5);
        Integer rows = jdbc.queryForObject("select count(*) from tier_cache_entry", Integer.class);
        assertThat(rows).isEqualTo(2);

        mvc.perform(delete("/api/cache").param("pattern", "meter:42:*").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(2));

        Integer left = jdbc.queryForObject("select count(*) from tier_cache_entry", Integer.class);
        assertThat(left).isEqualTo(1);
    }

    @Test
    void rateLimit_shouldReturn429AndRetryAfter() throws Exception {
        String token = login("acct-" + System.nanoTime());
        boolean got429 = false;

        // limit is 5 per 60s in the test profile
        for (int i = 0; i < 10; i++) {
            MvcResult res = mvc.perform(get("/api/cache/stats").header("Authorization", "Bearer " + token)).andReturn();
            if (res.getResponse().getStatus() == 429) {
                got429 = true;
                assertThat(Integer.parseInt(res.getResponse().getHeader("Retry-After"))).isGreaterThanOrEqualTo(1);
                assertThat(res.getResponse().getHeader("X-RateLimit-Remaining")).isEqualTo("0");
                break;
            }
        }

        assertThat(got429).isTrue();
    }

    @Test
    void actuator_shouldBeReachable() throws Exception {
        mvc.perform(get("/actuator/health"))
                .andExpect(status().isOk());

        mvc.perform(get("/actuator/prometheus"))
                .andExpect(status().isOk());
    }

    private String login(String username) throws Exception {
        MvcResult res = mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(om.writeValueAsString(Map.of(
                                "username", username, "password", "demo-pass"))))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode json = om.readTree(res.getResponse().getContentAsString());
        return json.get("access_token").asText();
    }
}

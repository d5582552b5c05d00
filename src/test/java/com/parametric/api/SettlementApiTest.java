package com.parametric.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * HTTP surface: snake_case bodies and the {@code error_code} envelope for every failure class.
 */
@SpringBootTest(properties = "settlement.scheduling.enabled=false")
@AutoConfigureMockMvc
class SettlementApiTest {

    @Autowired MockMvc mvc;
    @Autowired ObjectMapper mapper;

    @Test
    void createPool_andDeposit() throws Exception {
        String poolId = createPool("api-pool");

        mvc.perform(post("/v1/pools/{id}/deposits", poolId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"amount\": 2500, \"tier\": \"tier_2\", \"reference\": \"wire-1\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pool_id").value(poolId))
            .andExpect(jsonPath("$.tier2_balance").value(2500));

        mvc.perform(get("/v1/pools/{id}/liquidity", poolId).param("amount", "1000"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.has_sufficient_liquidity").value(true))
            .andExpect(jsonPath("$.has_immediate_liquidity").value(false))
            .andExpect(jsonPath("$.estimated_liquidation_days").value(3));
    }

    @Test
    @DisplayName("Unknown ids answer 404 NOT_FOUND")
    void unknownPool_isNotFound() throws Exception {
        mvc.perform(get("/v1/pools/{id}", "POOL-missing"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("NOT_FOUND"))
            .andExpect(jsonPath("$.message").exists())
            .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    @DisplayName("Malformed input answers 400 with the matching code")
    void badInput_isBadRequest() throws Exception {
        mvc.perform(post("/v1/policies").contentType(MediaType.APPLICATION_JSON).content("{}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("VALIDATION_FAILED"));

        mvc.perform(post("/v1/policies").contentType(MediaType.APPLICATION_JSON).content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));

        mvc.perform(get("/v1/pools/{id}/liquidity", "POOL-any").param("amount", "lots"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("BAD_REQUEST"));

        mvc.perform(get("/v1/payouts/transactions").param("status", "vanished"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
    }

    @Test
    @DisplayName("Policy lifecycle over HTTP; an illegal move answers 409")
    void policyLifecycle() throws Exception {
        String poolId = createPool("api-policy-pool");
        Instant now = Instant.now();
        String application = "{"
            + "\"beneficiary_account_id\": \"ACC-API-01\","
            + "\"pool_id\": \"" + poolId + "\","
            + "\"product_type\": \"flood-index\","
            + "\"trigger_conditions\": [{"
            + "  \"parameter\": \"river_level_m\", \"operator\": \"gte\", \"threshold\": 6.5, \"unit\": \"m\","
            + "  \"location\": {\"latitude\": 23.7, \"longitude\": 90.4, \"region\": \"dhaka\"},"
            + "  \"measurement_period\": \"daily\"}],"
            + "\"coverage_details\": {\"max_payout\": 25000, \"deductible\": 1000, \"currency\": \"USD\"},"
            + "\"premium_structure\": {\"base_premium\": 900, \"payment_frequency\": \"annual\", \"currency\": \"USD\"},"
            + "\"coverage_start\": \"" + now.minus(Duration.ofDays(1)) + "\","
            + "\"coverage_end\": \"" + now.plus(Duration.ofDays(180)) + "\""
            + "}";

        MvcResult issued = mvc.perform(post("/v1/policies").contentType(MediaType.APPLICATION_JSON).content(application))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("draft"))
            .andExpect(jsonPath("$.trigger_conditions[0].operator").value("gte"))
            .andReturn();
        String policyId = mapper.readTree(issued.getResponse().getContentAsString()).get("policy_id").asText();
        assertTrue(policyId.startsWith("POL-"));

        mvc.perform(post("/v1/policies/{id}/cancel", policyId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\": \"duplicate application\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("cancelled"));

        mvc.perform(post("/v1/policies/{id}/activate", policyId))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error_code").value("INVALID_STATE_TRANSITION"));

        mvc.perform(get("/v1/policies/{id}/payouts", policyId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isEmpty());
    }

    private String createPool(String name) throws Exception {
        MvcResult created = mvc.perform(post("/v1/pools")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"" + name + "\", \"currency\": \"USD\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.name").value(name))
            .andReturn();
        JsonNode body = mapper.readTree(created.getResponse().getContentAsString());
        return body.get("pool_id").asText();
    }
}

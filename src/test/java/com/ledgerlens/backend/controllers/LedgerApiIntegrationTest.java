package com.ledgerlens.backend.controllers;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class LedgerApiIntegrationTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @AfterEach
    void cleanUp() {
        jdbcTemplate.update("delete from transactions");
        jdbcTemplate.update("delete from categories where parent_id is not null");
        jdbcTemplate.update("delete from categories");
    }

    @Test
    void rulesImport_isStoredAndListed() throws Exception {
        String body = "{\"mode\": \"RULES\", \"columns\": {"
                + "\"Date\": [\"2024-01-15\", \"2024-01-16\", \"2024-01-17\"],"
                + "\"Description\": [\"UBER TRIP 8812\", \"ACME PAYROLL\", \"Corner shop\"],"
                + "\"Amount\": [\"-12.00\", \"2,500.00\", \"-3.20\"]}}";

        mockMvc.perform(post("/api/imports").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.processor").value("RuleBasedStatementProcessor"))
                .andExpect(jsonPath("$.data.rowsStored").value(3))
                .andExpect(jsonPath("$.data.fullyStored").value(true))
                .andExpect(jsonPath("$.data.pipeline.defaultedRows").value(1));

        mockMvc.perform(get("/api/transactions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(3))
                .andExpect(jsonPath("$.data[0].description").value("UBER TRIP 8812"))
                .andExpect(jsonPath("$.data[0].category").value("Transportation"))
                .andExpect(jsonPath("$.data[1].category").value("Income"))
                .andExpect(jsonPath("$.data[1].subCategory").value("Salary"))
                .andExpect(jsonPath("$.data[2].category").value("Uncategorized"));

        mockMvc.perform(get("/api/categories"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.Income[0]").value("Salary"));
    }

    @Test
    void aiImport_withoutInferenceKey_isUnprocessable() throws Exception {
        String body = "{\"mode\": \"AI\", \"columns\": {"
                + "\"Date\": [\"2024-01-15\"], \"Description\": [\"Coffee\"], \"Amount\": [\"-4.50\"]}}";

        mockMvc.perform(post("/api/imports").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false));

        mockMvc.perform(get("/api/transactions"))
                .andExpect(jsonPath("$.data.length()").value(0));
    }
}

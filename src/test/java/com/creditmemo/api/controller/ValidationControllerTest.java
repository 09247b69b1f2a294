package com.creditmemo.api.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web tests for the validation and configuration endpoints.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ValidationControllerTest {

    private static final String MATRICES = json(
        "'matrices': {" +
        "'contract': [" +
        "{'levelText': 'Level 1', 'designation': 'Sales Manager', 'amountRange': 'Up to 10,000'}," +
        "{'levelText': 'Level 2', 'designation': 'Finance Manager', 'amountRange': '10,001 - 100,000'}," +
        "{'levelText': 'Level 3', 'designation': 'CFO', 'amountRange': 'Above 100,000'}" +
        "]" +
        "}");

    private static final String RECORDS = json(
        "'records': [" +
        "{'Memo': 'CM100', 'Customer Name': 'Acme Retail', 'Cm Date': '2024-01-05', 'Created By': 'John Smith'," +
        "'Amount': 50000, 'Reason': 'Contract price adjustment', 'Date Of Approval': '2024-01-02'," +
        "'Approver': 'Jane Doe', 'Approver Designation': 'Finance Manager'}," +
        "{'Memo': 'CM100', 'Customer Name': 'Acme Retail', 'Cm Date': '2024-01-05', 'Created By': 'Jane Doe'," +
        "'Amount': '150,000', 'Reason': 'Contract rebate', 'Date Of Approval': '2024-01-02'," +
        "'Approver': 'jane doe', 'Approver Designation': 'Sales Manager'}," +
        "{'Memo': 'CM200', 'Customer Name': 'Globex', 'Cm Date': '2024-01-05', 'Created By': 'John Smith'," +
        "'Amount': 5000, 'Reason': 'Promotional credit', 'Date Of Approval': '2024-01-02'," +
        "'Approver': 'Jane Doe', 'Approver Designation': 'Marketing Manager'}" +
        "]");

    @Autowired
    private MockMvc mockMvc;

    private static String json(String singleQuoted) {
        return singleQuoted.replace('\'', '"');
    }

    @Test
    void testValidateReturnsAugmentedTable() throws Exception {
        mockMvc.perform(post("/api/v1/validations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{" + RECORDS + "," + MATRICES + "}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.summary.totalMemos").value(3))
            .andExpect(jsonPath("$.summary.compliant").value(1))
            .andExpect(jsonPath("$.settings.sla_days").value(5))
            .andExpect(jsonPath("$.results", hasSize(3)))
            .andExpect(jsonPath("$.results[0]['Memo']").value("CM100"))
            .andExpect(jsonPath("$.results[0]['Reason Class']").value("Contract"))
            .andExpect(jsonPath("$.results[0]['SOX Status']").value("SOX Compliant"))
            .andExpect(jsonPath("$.results[0]['Risk Level']").value("Low"))
            .andExpect(jsonPath("$.results[0]['Timeline Status']").value("Within 5 days"))
            .andExpect(jsonPath("$.results[0]['Approval Timeline (Business Days)']").value(3))
            .andExpect(jsonPath("$.results[0]['Duplicate Memo']").value("Yes"))
            .andExpect(jsonPath("$.results[1]['Missing Approvals']").value("Level 2–3 Missing"))
            .andExpect(jsonPath("$.results[1]['Designation Level Check']").value("Violation"))
            .andExpect(jsonPath("$.results[2]['Reason Class']").value("Promotional"))
            .andExpect(jsonPath("$.results[2]['Missing Approvals']").value("Missing amount or matrix not available"))
            .andExpect(jsonPath("$.results[2]['Duplicate Memo']").value("No"));
    }

    @Test
    void testFiltersNarrowResultsButNotSummary() throws Exception {
        mockMvc.perform(post("/api/v1/validations")
                .param("status", "SOX Violation")
                .param("risk", "High")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{" + RECORDS + "," + MATRICES + "}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.summary.totalMemos").value(3))
            .andExpect(jsonPath("$.results", hasSize(2)));
    }

    @Test
    void testSettingsOverride() throws Exception {
        mockMvc.perform(post("/api/v1/validations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{" + RECORDS + "," + MATRICES + ", \"settings\": {\"sla_days\": 2}}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.settings.sla_days").value(2))
            .andExpect(jsonPath("$.results[0]['Timeline Status']").value("Over 2 days"));
    }

    @Test
    void testUnknownMatrixCategoryIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/validations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{" + RECORDS + ", \"matrices\": {\"rebates\": []}}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Unknown matrix category: rebates"));
    }

    @Test
    void testInvalidSettingIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/validations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{" + RECORDS + "," + MATRICES + ", \"settings\": {\"sla_days\": 0}}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testMissingRecordsIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/validations")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{" + MATRICES + "}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.records").value("Records are required"));
    }

    @Test
    void testClassify() throws Exception {
        mockMvc.perform(post("/api/v1/validations/classify").param("reason", "Contract promotion"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.reasonClass").value("Promotional"))
            .andExpect(jsonPath("$.matrix").value("promotional"));
    }

    @Test
    void testDefaultComplianceSettings() throws Exception {
        mockMvc.perform(get("/api/v1/config/compliance"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sla_days").value(5))
            .andExpect(jsonPath("$.missing_levels_for_high").value(2))
            .andExpect(jsonPath("$.keywords_contract[0]").value("contract"));
    }
}

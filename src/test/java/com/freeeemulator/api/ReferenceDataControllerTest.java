package com.freeeemulator.api;

import com.freeeemulator.oauth.TokenService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import static org.hamcrest.Matchers.everyItem;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Seeded reference data and request validation over HTTP.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
class ReferenceDataControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TokenService tokenService;

    private String bearer;

    @BeforeEach
    void setUp() {
        bearer = "Bearer " + tokenService.issueAccessToken();
    }

    @Test
    void testListCompanies() throws Exception {
        mockMvc.perform(get("/api/1/companies").header("Authorization", bearer))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.companies", hasSize(1)))
            .andExpect(jsonPath("$.companies[0].display_name").value("Pigeonworks LLC"));
    }

    @Test
    void testGetCompany_UnknownId() throws Exception {
        mockMvc.perform(get("/api/1/companies/999").header("Authorization", bearer))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void testGetCompany_NonNumericId() throws Exception {
        mockMvc.perform(get("/api/1/companies/abc").header("Authorization", bearer))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_parameter"))
            .andExpect(jsonPath("$.error_description").value("Invalid id"));
    }

    @Test
    void testListAccountItems() throws Exception {
        mockMvc.perform(get("/api/1/account_items").param("company_id", "1").header("Authorization", bearer))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.account_items[0].id").value(101))
            .andExpect(jsonPath("$.account_items[0].name").value("現金"));
    }

    @Test
    void testListAccountItems_MissingCompanyId() throws Exception {
        mockMvc.perform(get("/api/1/account_items").header("Authorization", bearer))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_parameter"))
            .andExpect(jsonPath("$.error_description").value("Missing company_id"));
    }

    @Test
    void testListWalletables_TypeFilter() throws Exception {
        mockMvc.perform(get("/api/1/walletables")
                .param("company_id", "1")
                .param("type", "credit_card")
                .header("Authorization", bearer))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.walletables", hasSize(2)))
            .andExpect(jsonPath("$.walletables[*].type", everyItem(is("credit_card"))));
    }

    @Test
    void testListWalletables_UnknownTypeIsEmpty() throws Exception {
        mockMvc.perform(get("/api/1/walletables")
                .param("company_id", "1")
                .param("type", "crypto")
                .header("Authorization", bearer))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.walletables", hasSize(0)));
    }

    @Test
    void testCreateWalletTxn_MissingCompanyId() throws Exception {
        mockMvc.perform(post("/api/1/wallet_txns")
                .header("Authorization", bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"date\":\"2024-11-20\",\"amount\":-500,"
                    + "\"walletable_type\":\"wallet\",\"walletable_id\":4}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_parameter"))
            .andExpect(jsonPath("$.error_description").value("Missing company_id"));
    }

    @Test
    void testCreateDeal_MalformedBody() throws Exception {
        mockMvc.perform(post("/api/1/deals")
                .header("Authorization", bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void testCreateWalletTxn_UnsupportedContentType() throws Exception {
        mockMvc.perform(post("/api/1/wallet_txns")
                .header("Authorization", bearer)
                .contentType(MediaType.TEXT_PLAIN)
                .content("company_id=1"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void testCreateReceipt_JsonInsteadOfMultipart() throws Exception {
        mockMvc.perform(post("/api/1/receipts")
                .header("Authorization", bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"company_id\":1}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_request"));
    }

    @Test
    void testCreateDeal_NullDetailLine() throws Exception {
        mockMvc.perform(post("/api/1/deals")
                .header("Authorization", bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"company_id\":1,\"issue_date\":\"2024-11-20\",\"type\":\"expense\","
                    + "\"details\":[null]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_parameter"))
            .andExpect(jsonPath("$.error_description").value("Invalid details"));
    }

    @Test
    void testCreateDeal_NullPaymentLine() throws Exception {
        mockMvc.perform(post("/api/1/deals")
                .header("Authorization", bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"company_id\":1,\"issue_date\":\"2024-11-20\",\"type\":\"expense\","
                    + "\"details\":[{\"account_item_id\":502,\"amount\":1000}],\"payments\":[null]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_parameter"))
            .andExpect(jsonPath("$.error_description").value("Invalid payments"));
    }

    @Test
    void testCreateJournal_NullDetailLine() throws Exception {
        mockMvc.perform(post("/api/1/journals")
                .header("Authorization", bearer)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"company_id\":1,\"issue_date\":\"2024-11-20\",\"details\":[null]}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_parameter"))
            .andExpect(jsonPath("$.error_description").value("Invalid details"));
    }

    @Test
    void testGetDeal_UnknownId() throws Exception {
        mockMvc.perform(get("/api/1/deals/987654321").header("Authorization", bearer))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void testListWalletTxns_InvalidStatus() throws Exception {
        mockMvc.perform(get("/api/1/wallet_txns")
                .param("company_id", "1")
                .param("status", "pending")
                .header("Authorization", bearer))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("invalid_parameter"));
    }
}

package com.flagship.medexchange_ledger.ledger;

import com.flagship.medexchange_ledger.IntegrationTestSupport;
import com.flagship.medexchange_ledger.money.CurrencyCode;
import com.flagship.medexchange_ledger.security.CallerContext;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class WalletControllerTest extends IntegrationTestSupport {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void anonymousCallerRejected() throws Exception {
        mockMvc.perform(get("/api/wallet"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHENTICATED"));
    }

    @Test
    void openAndReadWallet() throws Exception {
        String userId = uniqueId("pharmacy");

        mockMvc.perform(post("/api/wallet")
                        .header(CallerContext.CALLER_ID_HEADER, userId)
                        .header(CallerContext.CALLER_ROLE_HEADER, "party")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currency\":\"XOF\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currency").value("XOF"))
                .andExpect(jsonPath("$.balance_minor").value(0));

        fundWallet(userId, CurrencyCode.XOF, 1500);

        mockMvc.perform(get("/api/wallet")
                        .header(CallerContext.CALLER_ID_HEADER, userId)
                        .header(CallerContext.CALLER_ROLE_HEADER, "PARTY"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance_minor").value(1500))
                .andExpect(jsonPath("$.display").value("1,500 XOF"));

        mockMvc.perform(get("/api/wallet/ledger")
                        .header(CallerContext.CALLER_ID_HEADER, userId)
                        .header(CallerContext.CALLER_ROLE_HEADER, "PARTY"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void unknownCurrencyIsInvalidArgument() throws Exception {
        mockMvc.perform(post("/api/wallet")
                        .header(CallerContext.CALLER_ID_HEADER, uniqueId("pharmacy"))
                        .header(CallerContext.CALLER_ROLE_HEADER, "PARTY")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currency\":\"ABC\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void missingWalletIsNotFound() throws Exception {
        mockMvc.perform(get("/api/wallet")
                        .header(CallerContext.CALLER_ID_HEADER, uniqueId("nobody"))
                        .header(CallerContext.CALLER_ROLE_HEADER, "PARTY"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }
}

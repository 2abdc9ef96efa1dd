package com.meterly.api.billing;

import com.meterly.api.billing.exceptions.ProcessorException;
import com.meterly.api.billing.exceptions.WebhookPayloadException;
import com.meterly.api.billing.exceptions.WebhookSignatureException;
import com.meterly.api.platform.GlobalControllerAdvice;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
public class StripeWebhookControllerTest {

    private static final String PAYLOAD = "{\"id\":\"evt_1\",\"type\":\"invoice.payment_succeeded\"}";

    @Mock
    private WebhookService webhookService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new StripeWebhookController(webhookService))
            .setControllerAdvice(new GlobalControllerAdvice())
            .build();
    }

    @Test
    void stripeWebhook() throws Exception {
        mockMvc.perform(
                post("/v1/billing/stripe/webhook")
                    .header("Stripe-Signature", "t=1,v1=abc")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(PAYLOAD))
            .andExpect(status().isOk());

        verify(webhookService).handleWebhookEvent(PAYLOAD, "t=1,v1=abc");
    }

    @Test
    void stripeWebhook_withoutSignature() throws Exception {
        mockMvc.perform(
                post("/v1/billing/stripe/webhook")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(PAYLOAD))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(webhookService);
    }

    @Test
    void stripeWebhook_withInvalidSignature() throws Exception {
        doThrow(new WebhookSignatureException("invalid signature", null))
            .when(webhookService).handleWebhookEvent(any(), any());

        mockMvc.perform(
                post("/v1/billing/stripe/webhook")
                    .header("Stripe-Signature", "t=1,v1=forged")
                    .content(PAYLOAD))
            .andExpect(status().isBadRequest());
    }

    @Test
    void stripeWebhook_withInvalidPayload() throws Exception {
        doThrow(new WebhookPayloadException("event has no data object"))
            .when(webhookService).handleWebhookEvent(any(), any());

        mockMvc.perform(
                post("/v1/billing/stripe/webhook")
                    .header("Stripe-Signature", "t=1,v1=abc")
                    .content(PAYLOAD))
            .andExpect(status().isBadRequest());
    }

    @Test
    void stripeWebhook_withStripeOutage() throws Exception {
        doThrow(new ProcessorException("stripe is unavailable", true))
            .when(webhookService).handleWebhookEvent(any(), any());

        mockMvc.perform(
                post("/v1/billing/stripe/webhook")
                    .header("Stripe-Signature", "t=1,v1=abc")
                    .content(PAYLOAD))
            .andExpect(status().isServiceUnavailable());
    }

    @Test
    void stripeWebhook_withConcurrentUpdate() throws Exception {
        doThrow(new OptimisticLockingFailureException("row was updated by another transaction"))
            .when(webhookService).handleWebhookEvent(any(), any());

        mockMvc.perform(
                post("/v1/billing/stripe/webhook")
                    .header("Stripe-Signature", "t=1,v1=abc")
                    .content(PAYLOAD))
            .andExpect(status().isConflict());
    }

    @Test
    void stripeWebhook_withUnsupportedMethod() throws Exception {
        mockMvc.perform(get("/v1/billing/stripe/webhook"))
            .andExpect(status().isMethodNotAllowed());

        verifyNoInteractions(webhookService);
    }
}

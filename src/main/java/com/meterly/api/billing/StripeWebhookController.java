package com.meterly.api.billing;

import com.meterly.api.billing.exceptions.ProcessorException;
import com.meterly.api.billing.exceptions.WebhookPayloadException;
import com.meterly.api.billing.exceptions.WebhookSignatureException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for billing related '{@code /v1/billing}' routes.
 */
@Validated
@RestController
@RequestMapping("/v1/billing")
@Slf4j
@Tag(name = "billing")
class StripeWebhookController {

    private final WebhookService webhookService;

    @Autowired
    StripeWebhookController(@NonNull WebhookService webhookService) {
        this.webhookService = webhookService;
    }

    /**
     * <p>
     * Receives Stripe webhook events and reconciles the local state of the subscription or invoice
     * they refer to. Stripe redelivers an event until it receives a successful response, and
     * every handler tolerates redelivery.</p>
     *
     * <p><b>See also:</b></p>
     * <ul>
     *     <li><a href="https://stripe.com/docs/billing/subscriptions/webhooks">Subscription
     *     webhooks</a></li>
     *     <li><a href="https://stripe.com/docs/webhooks/signatures">Webhook signatures</a></li>
     * </ul>
     *
     * @return <ul>
     * <li>{@code HTTP 200} if the event was handled or ignored.</li>
     * <li>{@code HTTP 400} if the signature or the event payload is invalid.</li>
     * <li>{@code HTTP 503} if Stripe could not be reached to handle the event.</li>
     * <li>{@code HTTP 500} on internal server errors.</li>
     * </ul>
     */
    @Operation(summary = "Stripe webhook receiver")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "event handled or ignored"),
        @ApiResponse(responseCode = "400", description = "invalid signature or payload"),
        @ApiResponse(responseCode = "503", description = "stripe is unavailable, the event should be redelivered"),
        @ApiResponse(responseCode = "500", description = "internal server error"),
    })
    @NonNull
    @PostMapping("/stripe/webhook")
    ResponseEntity<Void> stripeWebhook(
        @Valid @NotBlank @RequestHeader("Stripe-Signature") String payloadSignature,
        @Valid @NotBlank @RequestBody String body
    ) {
        try {
            webhookService.handleWebhookEvent(body, payloadSignature);
            return ResponseEntity.ok(null);
        } catch (WebhookSignatureException e) {
            log.info("failed to verify the event signature", e);
            return ResponseEntity.badRequest().build();
        } catch (WebhookPayloadException e) {
            log.info("failed to parse the event payload", e);
            return ResponseEntity.badRequest().build();
        } catch (ProcessorException e) {
            log.warn("failed to process the event payload", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }
}

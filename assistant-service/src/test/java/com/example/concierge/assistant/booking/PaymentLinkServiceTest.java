package com.example.concierge.assistant.booking;

import com.example.concierge.assistant.conversation.CityRef;
import com.example.concierge.assistant.conversation.SessionContext;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class PaymentLinkServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC);
    private final PaymentLinkService service = new PaymentLinkService(clock);

    @Test
    void linkCarriesSelectedPriceAndRoute() {
        SessionContext ctx = new SessionContext();
        ctx.setFrom(new CityRef("mumbai", "BOM"));
        ctx.setTo(new CityRef("goa", "GOI"));
        ctx.setDate("2025-06-02");
        ctx.setSelectedPrice(4200);

        PaymentLink link = service.create(ctx);

        assertThat(link.upiLink()).isEqualTo("upi://pay?pa=travel@agent&pn=Travel Agent&am=4200&cu=INR&tn=Flight mumbai-goa");
        assertThat(link.amount()).isEqualTo(4200);
        assertThat(link.currency()).isEqualTo("INR");
        assertThat(link.status()).isEqualTo("pending");
        assertThat(link.paymentId()).hasSize(8);
        assertThat(link.createdAt()).isEqualTo(clock.instant());
        assertThat(link.description()).isEqualTo("Flight from mumbai to goa on 2025-06-02");
    }

    @Test
    void missingSelectionUsesDefaultPrice() {
        PaymentLink link = service.create(new SessionContext());

        assertThat(link.amount()).isEqualTo(PaymentLinkService.DEFAULT_PRICE);
        assertThat(link.upiLink()).endsWith("&am=5000&cu=INR&tn=Flight Unknown-Unknown");
    }
}

package com.example.concierge.assistant.booking;

import java.time.Instant;

public record PaymentLink(String paymentId,
                          String upiLink,
                          int amount,
                          String currency,
                          String description,
                          Instant createdAt,
                          String status) {
}

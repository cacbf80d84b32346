package com.example.concierge.assistant.conversation;

import org.springframework.stereotype.Component;

/**
 * Maps the current session context to the next action. Pure: no I/O, no mutation.
 */
@Component
public class ConversationPolicy {

    /**
     * Order matters: a fully populated context always searches, even while in review or payment,
     * which means the stage dispatch below is only reached through {@link #decideStage}.
     */
    public ConversationAction decide(SessionContext ctx) {
        if (ctx == null) return ConversationAction.PROMPT_MISSING;
        if (ctx.hasAllSlots()) {
            return ConversationAction.SEARCH_FLIGHTS;
        }
        if (!ctx.hasIntent() || !ctx.hasFrom() || !ctx.hasTo() || !ctx.hasDate()) {
            return ConversationAction.PROMPT_MISSING;
        }
        return decideStage(ctx);
    }

    /**
     * Stage machine dispatch. Used directly by the explicit checkout and payment-confirmation commands.
     */
    public ConversationAction decideStage(SessionContext ctx) {
        if (ctx == null) return ConversationAction.PROMPT_MISSING;
        BookingStage stage = ctx.getBookingStage();
        if (stage == null || stage == BookingStage.COLLECT_SLOTS) {
            return ConversationAction.PROMPT_MISSING;
        }
        switch (stage) {
            case SEARCH:
                return ConversationAction.SEARCH_FLIGHTS;
            case REVIEW:
                return ctx.getIntent() == Intent.CONFIRM
                        ? ConversationAction.REQUEST_PAYMENT
                        : ConversationAction.SEARCH_FLIGHTS;
            case PAYMENT:
                return ctx.isPaymentConfirmed()
                        ? ConversationAction.CONFIRM
                        : ConversationAction.REQUEST_PAYMENT;
            default:
                return ConversationAction.PROMPT_MISSING;
        }
    }
}

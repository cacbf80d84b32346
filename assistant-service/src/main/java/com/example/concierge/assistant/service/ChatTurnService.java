package com.example.concierge.assistant.service;

import com.example.concierge.assistant.booking.PaymentLink;
import com.example.concierge.assistant.booking.PaymentLinkService;
import com.example.concierge.assistant.booking.Ticket;
import com.example.concierge.assistant.booking.TicketService;
import com.example.concierge.assistant.conversation.BookingStage;
import com.example.concierge.assistant.conversation.ConversationAction;
import com.example.concierge.assistant.conversation.ConversationPolicy;
import com.example.concierge.assistant.conversation.Intent;
import com.example.concierge.assistant.conversation.SessionContext;
import com.example.concierge.assistant.conversation.SessionLockRegistry;
import com.example.concierge.assistant.conversation.SlotExtraction;
import com.example.concierge.assistant.conversation.SlotStore;
import com.example.concierge.assistant.nlu.SlotExtractor;
import com.example.concierge.assistant.reconcile.ReconciledFlight;
import com.example.concierge.assistant.response.ResponseAssembler;
import com.example.concierge.assistant.search.FlightSearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;

/**
 * Runs one conversational turn: extract, merge, decide, act, render, persist.
 *
 * <p>Turns of one session are serialized. Nothing escapes as an exception: any failure becomes
 * the generic error reply and leaves the stored session untouched.</p>
 */
@Service
public class ChatTurnService {

    private static final Logger log = LoggerFactory.getLogger(ChatTurnService.class);

    private final SlotExtractor extractor;
    private final SlotStore slotStore;
    private final SessionLockRegistry locks;
    private final ConversationPolicy policy;
    private final FlightSearchService searchService;
    private final ResponseAssembler assembler;
    private final PaymentLinkService paymentLinks;
    private final TicketService tickets;
    private final Executor turnExecutor;

    public ChatTurnService(SlotExtractor extractor,
                           SlotStore slotStore,
                           SessionLockRegistry locks,
                           ConversationPolicy policy,
                           FlightSearchService searchService,
                           ResponseAssembler assembler,
                           PaymentLinkService paymentLinks,
                           TicketService tickets,
                           @Qualifier("turnExecutor") Executor turnExecutor) {
        this.extractor = extractor;
        this.slotStore = slotStore;
        this.locks = locks;
        this.policy = policy;
        this.searchService = searchService;
        this.assembler = assembler;
        this.paymentLinks = paymentLinks;
        this.tickets = tickets;
        this.turnExecutor = turnExecutor;
    }

    public ChatTurnResult handleTurn(String sessionId, String message) {
        return runTurn(normalizeSessionId(sessionId), message, () -> false);
    }

    /**
     * Same as {@link #handleTurn} on the turn executor. Cancelling the returned future discards the
     * turn: whatever the turn computed is not persisted.
     */
    public CompletableFuture<ChatTurnResult> handleTurnAsync(String sessionId, String message) {
        String sid = normalizeSessionId(sessionId);
        CompletableFuture<ChatTurnResult> future = new CompletableFuture<>();
        turnExecutor.execute(() -> {
            if (future.isCancelled()) return;
            future.complete(runTurn(sid, message, future::isCancelled));
        });
        return future;
    }

    /**
     * The user accepted the flight under review and wants to pay.
     */
    public ChatTurnResult checkout(String sessionId) {
        return runCommand(sessionId, ctx -> ctx.setIntent(Intent.CONFIRM));
    }

    /**
     * The payment provider (or the user) reports the payment as done. Only counts once a payment
     * link has been issued; in any earlier stage the flag stays unset.
     */
    public ChatTurnResult confirmPayment(String sessionId) {
        return runCommand(sessionId, ctx -> {
            ctx.setIntent(Intent.PAYMENT_DONE);
            if (ctx.getBookingStage() == BookingStage.PAYMENT) {
                ctx.setPaymentConfirmed(true);
            } else {
                log.info("[ChatTurnService] Payment confirmation for {} ignored in stage {}",
                        sessionId, ctx.getBookingStage());
            }
        });
    }

    private ChatTurnResult runTurn(String sessionId, String message, BooleanSupplier cancelled) {
        try {
            return locks.withLock(sessionId, () -> {
                SlotExtraction extraction = extractor.extract(Objects.toString(message, ""));
                SessionContext ctx = slotStore.merge(sessionId, extraction);
                ConversationAction action = policy.decide(ctx);
                log.debug("[ChatTurnService] {} {} -> {}", sessionId, ctx, action.value());
                ChatTurnResult result = execute(sessionId, ctx, action);
                persistUnlessCancelled(sessionId, ctx, cancelled);
                return result;
            });
        } catch (Exception e) {
            log.error("[ChatTurnService] Turn failed for session {}: {}", sessionId, e.toString(), e);
            return errorResult(sessionId);
        }
    }

    private ChatTurnResult runCommand(String sessionId, Consumer<SessionContext> command) {
        String sid = normalizeSessionId(sessionId);
        try {
            return locks.withLock(sid, () -> {
                SessionContext ctx = slotStore.load(sid).orElseGet(SessionContext::new);
                command.accept(ctx);
                ConversationAction action = policy.decideStage(ctx);
                log.debug("[ChatTurnService] {} command on {} -> {}", sid, ctx, action.value());
                ChatTurnResult result = execute(sid, ctx, action);
                slotStore.save(sid, ctx);
                return result;
            });
        } catch (Exception e) {
            log.error("[ChatTurnService] Command failed for session {}: {}", sid, e.toString(), e);
            return errorResult(sid);
        }
    }

    private ChatTurnResult execute(String sessionId, SessionContext ctx, ConversationAction action) {
        switch (action) {
            case SEARCH_FLIGHTS:
                return search(sessionId, ctx);
            case REQUEST_PAYMENT: {
                PaymentLink link = paymentLinks.create(ctx);
                // a fresh link needs a fresh confirmation
                ctx.setPaymentConfirmed(false);
                ctx.advanceTo(BookingStage.PAYMENT);
                return result(sessionId, ctx, assembler.paymentPrompt(link.upiLink()), List.of());
            }
            case CONFIRM: {
                Ticket ticket = tickets.issue(sessionId, ctx);
                ctx.advanceTo(BookingStage.CONFIRMED);
                return result(sessionId, ctx, assembler.confirmation(ticket.pnr(), ticket.route(), ticket.date()), List.of());
            }
            case PROMPT_MISSING:
            default:
                return result(sessionId, ctx, assembler.promptForMissing(ctx), List.of());
        }
    }

    private ChatTurnResult search(String sessionId, SessionContext ctx) {
        List<ReconciledFlight> flights = searchService.search(ctx);
        ctx.setLastResultsCount(flights.size());
        if (flights.isEmpty()) {
            ctx.advanceTo(BookingStage.SEARCH);
            return result(sessionId, ctx, ResponseAssembler.NO_FLIGHTS, List.of());
        }
        if (isPaymentUnderway(ctx)) {
            log.info("[ChatTurnService] {} re-searched in stage {}; keeping selected {} at {}",
                    sessionId, ctx.getBookingStage(), ctx.getSelectedFlightCode(), ctx.getSelectedPrice());
        } else {
            ReconciledFlight top = flights.get(0);
            ctx.setSelectedFlightCode(top.flightCode());
            ctx.setSelectedPrice(top.price());
            ctx.setSelectedSource(top.selectedSource());
        }
        ctx.advanceTo(BookingStage.REVIEW);
        return result(sessionId, ctx, assembler.summarize(ctx, flights), flights);
    }

    /** The selection is frozen once the payment link for it went out. */
    private static boolean isPaymentUnderway(SessionContext ctx) {
        BookingStage stage = ctx.getBookingStage();
        return stage != null && !stage.isBefore(BookingStage.PAYMENT);
    }

    private ChatTurnResult result(String sessionId, SessionContext ctx, String reply, List<ReconciledFlight> flights) {
        return new ChatTurnResult(sessionId, reply, assembler.cards(flights),
                assembler.stateSummary(ctx), assembler.suggestedActions(ctx));
    }

    private void persistUnlessCancelled(String sessionId, SessionContext ctx, BooleanSupplier cancelled) {
        if (cancelled.getAsBoolean()) {
            log.info("[ChatTurnService] Turn for session {} was cancelled; state not saved", sessionId);
            return;
        }
        slotStore.save(sessionId, ctx);
    }

    private static ChatTurnResult errorResult(String sessionId) {
        return new ChatTurnResult(sessionId, ResponseAssembler.ERROR_REPLY, List.of(), Map.of(),
                ResponseAssembler.ERROR_ACTIONS);
    }

    private static String normalizeSessionId(String sessionId) {
        return sessionId != null && !sessionId.isBlank() ? sessionId.trim() : UUID.randomUUID().toString();
    }
}

package com.example.concierge.assistant.search;

import com.example.concierge.assistant.config.AssistantSearchProperties;
import com.example.concierge.assistant.conversation.SessionContext;
import com.example.concierge.assistant.nlu.CityDirectory;
import com.example.concierge.assistant.reconcile.ReconciledFlight;
import com.example.concierge.assistant.reconcile.Reconciler;
import com.example.concierge.assistant.source.RawOffer;
import com.example.concierge.assistant.source.SourceClient;
import com.example.concierge.assistant.source.SourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Queries every source in parallel, reconciles what came back and ranks the result.
 * A source that fails or runs past its timeout contributes no offers; it never fails the search.
 */
@Service
public class FlightSearchService {

    private static final Logger log = LoggerFactory.getLogger(FlightSearchService.class);

    private final List<SourceClient> sources;
    private final Reconciler reconciler;
    private final Ranker ranker;
    private final CityDirectory cities;
    private final AssistantSearchProperties props;
    private final Executor sourceExecutor;
    private final Executor reconcileExecutor;
    private final Clock clock;

    public FlightSearchService(ObjectProvider<SourceClient> sources,
                               Reconciler reconciler,
                               Ranker ranker,
                               CityDirectory cities,
                               AssistantSearchProperties props,
                               @Qualifier("sourceExecutor") Executor sourceExecutor,
                               @Qualifier("reconcileExecutor") Executor reconcileExecutor,
                               Clock clock) {
        this.sources = sources.orderedStream().toList();
        this.reconciler = reconciler;
        this.ranker = ranker;
        this.cities = cities;
        this.props = props;
        this.sourceExecutor = sourceExecutor;
        this.reconcileExecutor = reconcileExecutor;
        this.clock = clock;
        log.info("[FlightSearchService] Sources: {}", this.sources.stream().map(SourceClient::name).toList());
    }

    /**
     * Searches the route and date held in the context. Returns an empty list when the route cannot be
     * resolved or no source returned anything.
     */
    public List<ReconciledFlight> search(SessionContext ctx) {
        Optional<String> fromCode = cities.codeFor(ctx.getFrom());
        Optional<String> toCode = cities.codeFor(ctx.getTo());
        if (fromCode.isEmpty() || toCode.isEmpty()) {
            log.warn("[FlightSearchService] No airport code for {} -> {}", ctx.getFrom(), ctx.getTo());
            return List.of();
        }
        if (fromCode.get().equals(toCode.get())) {
            log.info("[FlightSearchService] Origin and destination resolve to the same airport {}", fromCode.get());
            return List.of();
        }

        List<String> dates = SearchWindow.datesFor(ctx, clock, props.getWeekSearchDays());
        Map<String, Map<String, CompletableFuture<List<RawOffer>>>> pending = new LinkedHashMap<>();
        for (String date : dates) {
            Map<String, CompletableFuture<List<RawOffer>>> perSource = new LinkedHashMap<>();
            for (SourceClient client : sources) {
                perSource.put(client.name(), fetchAsync(client, fromCode.get(), toCode.get(), date));
            }
            pending.put(date, perSource);
        }

        List<CompletableFuture<List<ReconciledFlight>>> reconciled = new ArrayList<>();
        for (Map.Entry<String, Map<String, CompletableFuture<List<RawOffer>>>> en : pending.entrySet()) {
            String date = en.getKey();
            CompletableFuture<Map<String, List<RawOffer>>> gathered = collect(en.getValue());
            reconciled.add(props.isOffloadReconciliation()
                    ? gathered.thenApplyAsync(bySource -> reconcileDay(date, bySource), reconcileExecutor)
                    : CompletableFuture.completedFuture(reconcileDay(date, gathered.join())));
        }
        CompletableFuture.allOf(reconciled.toArray(new CompletableFuture[0])).join();

        List<ReconciledFlight> all = new ArrayList<>();
        reconciled.forEach(f -> all.addAll(f.join()));
        List<ReconciledFlight> ranked = ranker.rank(all, ctx.getPreference().keyword());
        log.info("[FlightSearchService] {} -> {} on {}: {} reconciled, {} shown",
                fromCode.get(), toCode.get(), ctx.getDate(), all.size(), ranked.size());
        return ranked;
    }

    private CompletableFuture<List<RawOffer>> fetchAsync(SourceClient client, String from, String to, String date) {
        int cap = Math.max(1, props.getMaxOffersRequested());
        return CompletableFuture
                .supplyAsync(() -> {
                    List<RawOffer> offers = client.fetch(from, to, date);
                    if (offers == null) return List.<RawOffer>of();
                    return offers.size() > cap ? List.copyOf(offers.subList(0, cap)) : offers;
                }, sourceExecutor)
                .orTimeout(props.getSourceTimeoutMs(), TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    if (cause instanceof TimeoutException) {
                        log.warn("[FlightSearchService] {} timed out after {}ms for {} -> {} on {}",
                                client.name(), props.getSourceTimeoutMs(), from, to, date);
                    } else if (cause instanceof SourceException) {
                        log.warn("[FlightSearchService] {} unavailable: {}", client.name(), cause.getMessage());
                    } else {
                        log.warn("[FlightSearchService] {} failed: {}", client.name(), cause.toString());
                    }
                    return List.of();
                });
    }

    private CompletableFuture<Map<String, List<RawOffer>>> collect(Map<String, CompletableFuture<List<RawOffer>>> perSource) {
        return CompletableFuture.allOf(perSource.values().toArray(new CompletableFuture[0]))
                .thenApply(v -> {
                    Map<String, List<RawOffer>> bySource = new LinkedHashMap<>();
                    perSource.forEach((name, f) -> bySource.put(name, f.join()));
                    return bySource;
                });
    }

    private List<ReconciledFlight> reconcileDay(String date, Map<String, List<RawOffer>> bySource) {
        if (bySource.values().stream().allMatch(List::isEmpty)) {
            log.info("[FlightSearchService] No offers from any source for {}", date);
            return List.of();
        }
        log.debug("[FlightSearchService] Reconciliation report for {}: {}", date, reconciler.report(bySource));
        return reconciler.reconcile(bySource);
    }
}

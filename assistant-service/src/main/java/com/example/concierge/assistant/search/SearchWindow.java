package com.example.concierge.assistant.search;

import com.example.concierge.assistant.conversation.SessionContext;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Dates a search covers: the requested day, or the coming days for an open week search.
 */
final class SearchWindow {

    private SearchWindow() {
    }

    static List<String> datesFor(SessionContext ctx, Clock clock, int weekSearchDays) {
        if (ctx != null && !ctx.isWeekSearch()) {
            return List.of(ctx.getDate());
        }
        LocalDate today = LocalDate.now(clock);
        int days = Math.max(1, weekSearchDays);
        List<String> out = new ArrayList<>(days);
        for (int i = 0; i < days; i++) {
            out.add(today.plusDays(i).toString());
        }
        return out;
    }
}

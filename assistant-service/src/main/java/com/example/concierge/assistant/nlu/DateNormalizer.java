package com.example.concierge.assistant.nlu;

import com.example.concierge.assistant.conversation.SessionContext;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns natural-language dates into ISO dates. Open-ended phrases ("this week", "flexible")
 * become {@link SessionContext#WEEK_SEARCH}.
 */
@Component
public class DateNormalizer {

    private static final Pattern ISO = Pattern.compile("\\b(\\d{4})-(\\d{1,2})-(\\d{1,2})\\b");
    private static final Pattern DAY_MONTH = Pattern.compile(
            "\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+(jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*\\b");
    private static final Pattern MONTH_DAY = Pattern.compile(
            "\\b(jan|feb|mar|apr|may|jun|jul|aug|sep|oct|nov|dec)[a-z]*\\s+(\\d{1,2})(?:st|nd|rd|th)?\\b");
    private static final Pattern SLASH = Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})(?:/(\\d{2,4}))?\\b");
    private static final Pattern WEEKDAY = Pattern.compile(
            "\\b(?:next|on|this)\\s+(monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b");
    private static final Pattern OPEN_RANGE = Pattern.compile(
            "\\b(?:this week|any ?day|anytime|flexible|whenever|next few days)\\b");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12));

    private final Clock clock;

    public DateNormalizer(Clock clock) {
        this.clock = clock;
    }

    public Optional<String> normalize(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String low = text.toLowerCase(Locale.ROOT).trim();
        LocalDate today = LocalDate.now(clock);

        Matcher iso = ISO.matcher(low);
        if (iso.find()) {
            try {
                return Optional.of(LocalDate.of(Integer.parseInt(iso.group(1)),
                        Integer.parseInt(iso.group(2)), Integer.parseInt(iso.group(3))).toString());
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        }
        if (low.contains("day after tomorrow")) return Optional.of(today.plusDays(2).toString());
        if (low.contains("today") || low.contains("tonight")) return Optional.of(today.toString());
        if (low.contains("tomorrow")) return Optional.of(today.plusDays(1).toString());
        if (low.contains("next week")) return Optional.of(today.plusWeeks(1).toString());
        if (low.contains("next month")) return Optional.of(today.plusMonths(1).withDayOfMonth(1).toString());
        if (low.contains("this weekend")) {
            return Optional.of(today.with(TemporalAdjusters.nextOrSame(DayOfWeek.SATURDAY)).toString());
        }
        if (OPEN_RANGE.matcher(low).find()) return Optional.of(SessionContext.WEEK_SEARCH);

        Matcher wd = WEEKDAY.matcher(low);
        if (wd.find()) {
            DayOfWeek dow = DayOfWeek.valueOf(wd.group(1).toUpperCase(Locale.ROOT));
            return Optional.of(today.with(TemporalAdjusters.next(dow)).toString());
        }

        Matcher dm = DAY_MONTH.matcher(low);
        if (dm.find()) {
            Optional<String> d = dayOfYear(today, MONTHS.get(dm.group(2)), Integer.parseInt(dm.group(1)));
            if (d.isPresent()) return d;
        }
        Matcher md = MONTH_DAY.matcher(low);
        if (md.find()) {
            Optional<String> d = dayOfYear(today, MONTHS.get(md.group(1)), Integer.parseInt(md.group(2)));
            if (d.isPresent()) return d;
        }
        Matcher sl = SLASH.matcher(low);
        if (sl.find()) {
            int day = Integer.parseInt(sl.group(1));
            int month = Integer.parseInt(sl.group(2));
            if (sl.group(3) != null) {
                int year = Integer.parseInt(sl.group(3));
                if (year < 100) year += 2000;
                try {
                    return Optional.of(LocalDate.of(year, month, day).toString());
                } catch (DateTimeException e) {
                    return Optional.empty();
                }
            }
            return dayOfYear(today, month, day);
        }
        return Optional.empty();
    }

    /** Day/month in the current year, rolled to next year when already past. */
    private static Optional<String> dayOfYear(LocalDate today, int month, int day) {
        try {
            LocalDate target = LocalDate.of(today.getYear(), month, day);
            if (target.isBefore(today)) target = target.plusYears(1);
            return Optional.of(target.toString());
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}

package com.yescount.planner.domain.voting;

import com.yescount.planner.domain.model.VotingWindow;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Monthly voting cadence, all in UTC. Voting targets next month, opens on the last Friday
 * of the current month and closes at the end of the 1st of the target month.
 */
@Component
public class VotingWindowCalculator {

    private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_999_000);
    private static final DateTimeFormatter MONTH_LABEL = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.US);
    private static final DateTimeFormatter DEADLINE_LABEL = DateTimeFormatter.ofPattern("MMM d, h:mm a", Locale.US);

    private final Clock clock;

    public VotingWindowCalculator(Clock clock) {
        this.clock = clock;
    }

    public VotingWindow current() {
        return windowAt(OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC));
    }

    public VotingWindow windowAt(OffsetDateTime now) {
        OffsetDateTime utcNow = now.withOffsetSameInstant(ZoneOffset.UTC);
        YearMonth currentMonth = YearMonth.from(utcNow);
        YearMonth target = currentMonth.plusMonths(1);

        LocalDate lastFriday = currentMonth.atEndOfMonth().with(TemporalAdjusters.previousOrSame(DayOfWeek.FRIDAY));
        OffsetDateTime openUtc = lastFriday.atStartOfDay().atOffset(ZoneOffset.UTC);
        OffsetDateTime closeUtc = target.atDay(1).atTime(END_OF_DAY).atOffset(ZoneOffset.UTC);

        String label = target.format(MONTH_LABEL) + " voting closes " + closeUtc.format(DEADLINE_LABEL) + " UTC";
        boolean open = !utcNow.isBefore(openUtc) && !utcNow.isAfter(closeUtc);

        return new VotingWindow(target.getYear(), target.getMonthValue(), openUtc, closeUtc, label, open);
    }
}

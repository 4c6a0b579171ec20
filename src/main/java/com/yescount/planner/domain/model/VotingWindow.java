package com.yescount.planner.domain.model;

import java.time.OffsetDateTime;

public record VotingWindow(
        int targetYear,
        int targetMonth,
        OffsetDateTime openUtc,
        OffsetDateTime closeUtc,
        String deadlineLabel,
        boolean open
) {}

package com.yescount.planner.domain.availability;

import com.yescount.planner.domain.model.AvailabilityEntry;
import com.yescount.planner.domain.model.AvailabilitySlot;
import com.yescount.planner.domain.model.GroupAvailability;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class AvailabilityAggregator {

    /**
     * Groups rows by (date, timeStart, timeEnd) in first-seen order. A slot's overlap is the share of
     * the group that marked it, counting each participant once.
     */
    public GroupAvailability aggregate(List<AvailabilityEntry> rows, int participantCount) {
        Map<SlotKey, Set<Long>> grouped = new LinkedHashMap<>();
        for (AvailabilityEntry row : rows) {
            grouped.computeIfAbsent(new SlotKey(row.date(), row.timeStart(), row.timeEnd()),
                    key -> new LinkedHashSet<>()).add(row.participantId());
        }

        int denominator = Math.max(participantCount, 1);
        List<AvailabilitySlot> slots = grouped.entrySet().stream()
                .map(entry -> new AvailabilitySlot(
                        entry.getKey().date(),
                        entry.getKey().timeStart(),
                        entry.getKey().timeEnd(),
                        List.copyOf(entry.getValue()),
                        (double) entry.getValue().size() / denominator))
                .toList();
        return new GroupAvailability(participantCount, slots);
    }

    private record SlotKey(String date, String timeStart, String timeEnd) {}
}

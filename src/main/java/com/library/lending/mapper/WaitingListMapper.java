package com.library.lending.mapper;

import com.library.lending.dto.response.WaitingListEntryResponse;
import com.library.lending.entity.WaitingListEntry;

import java.util.ArrayList;
import java.util.List;

public final class WaitingListMapper {

    private WaitingListMapper() {}

    /**
     * Maps entries already sorted in queue order, numbering them from 1.
     */
    public static List<WaitingListEntryResponse> toResponses(List<WaitingListEntry> orderedEntries) {
        List<WaitingListEntryResponse> responses = new ArrayList<>(orderedEntries.size());
        int position = 1;
        for (WaitingListEntry entry : orderedEntries) {
            responses.add(new WaitingListEntryResponse(position++, entry.getStudentId(), entry.getEnqueuedAt()));
        }
        return responses;
    }
}

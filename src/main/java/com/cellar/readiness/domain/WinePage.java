package com.cellar.readiness.domain;

import lombok.Value;

import java.util.List;

/**
 * One page of wine rows ordered by id. nextCursor is the id of the last row, or null for an empty page.
 */
@Value
public class WinePage {
    List<WineRecord> rows;
    Long nextCursor;

    public static WinePage of(List<WineRecord> rows) {
        Long last = rows.isEmpty() ? null : rows.get(rows.size() - 1).getId();
        return new WinePage(List.copyOf(rows), last);
    }
}

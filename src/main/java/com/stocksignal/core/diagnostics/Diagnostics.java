package com.stocksignal.core.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-call sink for non-fatal conditions (undefined indicators, short history, skipped
 * instruments). Callers create one per unit of work and pass it in; nothing is shared
 * between calls.
 */
public final class Diagnostics {
    private final List<Entry> entries = new ArrayList<>();
    private final Map<CauseCode, Integer> counts = new EnumMap<>(CauseCode.class);

    public void add(CauseCode causeCode, String owner, String detail) {
        CauseCode code = causeCode == null ? CauseCode.NONE : causeCode;
        entries.add(new Entry(code, owner, detail));
        counts.merge(code, 1, Integer::sum);
    }

    public int count(CauseCode causeCode) {
        if (causeCode == null) {
            return 0;
        }
        return counts.getOrDefault(causeCode, 0);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<String> notes() {
        List<String> out = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            out.add(entry.toString());
        }
        return out;
    }

    public static final class Entry {
        public final CauseCode causeCode;
        public final String owner;
        public final String detail;

        private Entry(CauseCode causeCode, String owner, String detail) {
            this.causeCode = causeCode;
            this.owner = owner == null ? "" : owner.trim();
            this.detail = detail == null ? "" : detail.trim();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(causeCode.name());
            if (!owner.isEmpty()) {
                sb.append(" owner=").append(owner);
            }
            if (!detail.isEmpty()) {
                sb.append(' ').append(detail);
            }
            return sb.toString();
        }
    }
}

package com.openrangelabs.donpetre.mobility.model;

/**
 * Per-chunk transfer counters. Listings are never kept, only counts.
 */
public record TransferSummary(long listed, long filteredOut, long copied, long skipped, long bytesCopied) {

    public static TransferSummary empty() {
        return new TransferSummary(0, 0, 0, 0, 0);
    }

    public TransferSummary plus(TransferSummary other) {
        return new TransferSummary(
                listed + other.listed,
                filteredOut + other.filteredOut,
                copied + other.copied,
                skipped + other.skipped,
                bytesCopied + other.bytesCopied);
    }

    public long written() {
        return copied + skipped;
    }
}

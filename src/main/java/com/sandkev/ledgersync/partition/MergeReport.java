package com.sandkev.ledgersync.partition;

/**
 * @param partitions partitions touched by the merge
 * @param created    of which did not exist before
 * @param rowsAdded  net growth in rows across touched partitions
 * @param rowsTotal  rows in the touched partitions after the merge
 */
public record MergeReport(int partitions, int created, int rowsAdded, int rowsTotal) {

    public static final MergeReport EMPTY = new MergeReport(0, 0, 0, 0);

    public MergeReport plus(MergeReport o) {
        return new MergeReport(partitions + o.partitions, created + o.created,
                rowsAdded + o.rowsAdded, rowsTotal + o.rowsTotal);
    }
}

package taskq.engine.model;

/**
 * Counts from a single reaper cycle.
 */
public record ReapReport(int expired, int resultsPurged, int recordsPurged) {

    public static final ReapReport EMPTY = new ReapReport(0, 0, 0);

    public int total() {
        return expired + resultsPurged + recordsPurged;
    }
}

package taskq.engine.model;

/**
 * Queue ranking priority. Higher weight is dequeued first.
 */
public enum TaskPriority {
    LOW(1),
    NORMAL(2),
    HIGH(3),
    CRITICAL(4);

    private final int weight;

    TaskPriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    public static TaskPriority fromWeight(int weight) {
        for (TaskPriority p : values()) {
            if (p.weight == weight) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown priority weight: " + weight);
    }
}

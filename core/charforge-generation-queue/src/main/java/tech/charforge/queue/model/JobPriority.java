package tech.charforge.queue.model;

/**
 * Dequeue priority. Jobs with a higher weight are picked first.
 */
public enum JobPriority {
    LOW(1),
    NORMAL(2),
    HIGH(3),
    URGENT(4);

    private final int weight;

    JobPriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    public static JobPriority fromWeight(int weight) {
        for (JobPriority priority : values()) {
            if (priority.weight == weight) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority weight: " + weight);
    }
}

package info.isaksson.erland.sforganalyzer.analysis;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds shared by every traversal of one run. Passed explicitly through the depth-first search so the
 * analyzer itself holds no per-run state; the iteration counter is atomic so entry points could be walked
 * by several workers against one budget.
 */
final class TraversalContext {
    final int maxDepth;
    final int maxIterations;
    private final AtomicInteger iterations = new AtomicInteger();

    TraversalContext(int maxDepth, int maxIterations) {
        this.maxDepth = maxDepth;
        this.maxIterations = maxIterations;
    }

    /** Consume one edge traversal. @return false once the budget is spent; the counter never exceeds it */
    boolean tryAdvance() {
        while (true) {
            int current = iterations.get();
            if (current >= maxIterations) return false;
            if (iterations.compareAndSet(current, current + 1)) return true;
        }
    }

    int used() {
        return iterations.get();
    }

    boolean exhausted() {
        return iterations.get() >= maxIterations;
    }
}

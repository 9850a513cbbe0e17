package work.agentflow.kernel.graph;

/**
 * Graph node categories. Parallel entry and merge nodes are synthesized during lowering.
 */
public enum NodeKind {
    STEP,
    CHECKPOINT,
    PARALLEL_ENTRY,
    PARALLEL_MERGE
}

package com.autopar.core.transform;

import com.autopar.core.detect.ParallelRegion;
import com.autopar.core.tree.CombineKind;
import com.autopar.core.tree.NodeId;

/**
 * Outcome of one rewrite attempt. None of these is an exception: a mismatch or an abort
 * leaves the tree exactly as it was.
 */
public interface TransformResult {

    ParallelRegion region();

    default boolean isApplied() {
        return this instanceof Applied;
    }

    /** The region's slot now holds a {@code PARALLEL_TASK}; {@code version} is the committed tree version. */
    record Applied(ParallelRegion region, NodeId task, CombineKind combine, int workers, int version)
        implements TransformResult {}

    /** The backend cannot express the combination the region needs. */
    record BackendMismatch(ParallelRegion region, String reason) implements TransformResult {}

    /** The late consistency re-check failed. */
    record TransformAborted(ParallelRegion region, String reason) implements TransformResult {}
}

package org.satmesh.routing.probe;

import lombok.Value;
import org.satmesh.routing.core.MeshSnapshot;

/**
 * Outcome of one convergence wait.
 */
@Value
public class ConvergenceResult {
    /** True when the required number of identical consecutive samples was observed. */
    boolean converged;
    /** Samples taken. */
    int samples;
    /** Last snapshot sampled; {@code null} when no sample was taken. */
    MeshSnapshot finalSnapshot;
}

package org.carball.pgdiag.exception;

import lombok.Getter;

@Getter
public class PlanDepthExceededException extends DiagnosticsException {

    private final int maxDepth;

    public PlanDepthExceededException(int maxDepth) {
        super("Plan tree exceeds the maximum supported depth of " + maxDepth);
        this.maxDepth = maxDepth;
    }
}

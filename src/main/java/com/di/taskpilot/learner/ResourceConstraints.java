package com.di.taskpilot.learner;

/**
 * Upper bounds applied to a pattern's averages when recommending. Nulls mean CPU at most 1.0 and unbounded RAM.
 *
 * @param cpuMax fraction of host CPU
 * @param ramMax MB
 */
public record ResourceConstraints(Double cpuMax, Double ramMax) {

    public static final ResourceConstraints NONE = new ResourceConstraints(null, null);

    public boolean allows(ResourceProfile profile) {
        double cpuLimit = cpuMax != null ? cpuMax : 1.0;
        double ramLimit = ramMax != null ? ramMax : Double.POSITIVE_INFINITY;
        return profile.avgCpu() <= cpuLimit && profile.avgRam() <= ramLimit;
    }
}

package com.txscope.core.stats;

/**
 * Aggregate timings for one metric. All times are in seconds.
 *
 * Not thread-safe: an instance is owned by a single execution context until it is
 * merged into the {@link EngineStatsStore}, which serializes access per key.
 */
public class MethodStats {

    private long callCount;
    private double totalCallTime;
    private double totalExclusiveTime;
    private double minCallTime;
    private double maxCallTime;
    private double sumOfSquares;

    public void recordDataPoint(double duration, double exclusive) {
        if (callCount == 0) {
            minCallTime = duration;
            maxCallTime = duration;
        } else {
            minCallTime = Math.min(minCallTime, duration);
            maxCallTime = Math.max(maxCallTime, duration);
        }
        callCount++;
        totalCallTime += duration;
        totalExclusiveTime += exclusive;
        sumOfSquares += duration * duration;
    }

    public void merge(MethodStats other) {
        if (other.callCount == 0) return;
        if (callCount == 0) {
            minCallTime = other.minCallTime;
            maxCallTime = other.maxCallTime;
        } else {
            minCallTime = Math.min(minCallTime, other.minCallTime);
            maxCallTime = Math.max(maxCallTime, other.maxCallTime);
        }
        callCount += other.callCount;
        totalCallTime += other.totalCallTime;
        totalExclusiveTime += other.totalExclusiveTime;
        sumOfSquares += other.sumOfSquares;
    }

    public MethodStats copy() {
        MethodStats copy = new MethodStats();
        copy.merge(this);
        return copy;
    }

    public long getCallCount()             { return callCount; }
    public double getTotalCallTime()       { return totalCallTime; }
    public double getTotalExclusiveTime()  { return totalExclusiveTime; }
    public double getMinCallTime()         { return minCallTime; }
    public double getMaxCallTime()         { return maxCallTime; }
    public double getSumOfSquares()        { return sumOfSquares; }

    @Override
    public String toString() {
        return String.format("calls=%d total=%.6fs exclusive=%.6fs min=%.6fs max=%.6fs",
            callCount, totalCallTime, totalExclusiveTime, minCallTime, maxCallTime);
    }
}

package com.txscope.core;

/**
 * One in-flight traced operation on a scope stack.
 *
 * The tag is only used to identify the frame when the stack is found corrupted.
 * {@code childrenTime} accumulates the time of direct children as they are popped;
 * the name is assigned when the frame itself is popped.
 */
public final class ScopeFrame {

    private final Object tag;
    private final double startTime;
    private final boolean deductCallTimeFromParent;
    private double childrenTime;
    private String name;

    ScopeFrame(Object tag, double startTime, boolean deductCallTimeFromParent) {
        this.tag = tag;
        this.startTime = startTime;
        this.deductCallTimeFromParent = deductCallTimeFromParent;
    }

    public Object getTag()                       { return tag; }
    public double getStartTime()                 { return startTime; }
    public boolean isDeductCallTimeFromParent()  { return deductCallTimeFromParent; }
    public double getChildrenTime()              { return childrenTime; }

    /** Null until the frame has been popped. */
    public String getName()                      { return name; }

    void addChildrenTime(double seconds) {
        childrenTime += seconds;
    }

    void setName(String name) {
        this.name = name;
    }

    @Override
    public String toString() {
        return "ScopeFrame{tag=" + tag + ", name=" + name + "}";
    }
}

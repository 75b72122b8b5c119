package com.novemberain.quartz.store.cluster;

/**
 * Check-in record of one scheduler instance in the cluster.
 */
public class Scheduler {

    public static final long TIME_EPSILON = 7500L;
    private final String name;
    private final String instanceId;
    private final long lastCheckinTime;
    private final long checkinInterval;
    private final String recoverer;

    public Scheduler(String name, String instanceId, long lastCheckinTime, long checkinInterval,
                     String recoverer) {
        this.name = name;
        this.instanceId = instanceId;
        this.lastCheckinTime = lastCheckinTime;
        this.checkinInterval = checkinInterval;
        this.recoverer = recoverer;
    }

    public String getName() {
        return name;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public long getLastCheckinTime() {
        return lastCheckinTime;
    }

    public long getCheckinInterval() {
        return checkinInterval;
    }

    /**
     * @return id of the instance recovering this one, or null
     */
    public String getRecoverer() {
        return recoverer;
    }

    /**
     * Return true if scheduler is defunct for given time.
     * The allowance grows with the time since the observer's own last check-in,
     * so an observer that was itself stalled does not declare the others failed.
     *
     * @param time                  time to compare with
     * @param observerLastCheckin   last check-in time of the instance asking
     */
    public boolean isDefunct(long time, long observerLastCheckin) {
        return expectedCheckinTime(time - observerLastCheckin) < time;
    }

    private long expectedCheckinTime(long observerDelay) {
        return lastCheckinTime + Math.max(checkinInterval, observerDelay) + TIME_EPSILON;
    }

    @Override
    public String toString() {
        return "Scheduler{" + name + ", " + instanceId + ", lastCheckinTime=" + lastCheckinTime
                + ", checkinInterval=" + checkinInterval + ", recoverer=" + recoverer + '}';
    }
}

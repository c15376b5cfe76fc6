package org.pixelforge.metrics;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;

/**
 * Reads process resource counters through the platform MX beans.
 * <p>
 * Holds no state between calls: every {@link #measure(MeasuredTask)} is independent, so one
 * sampler can be shared by any number of threads. "Resident" memory is the JVM's view of it,
 * heap plus non-heap in use.
 */
public class ResourceSampler {

    /**
     * A unit of work to measure. Checked exceptions thrown by it propagate out of
     * {@link #measure(MeasuredTask)} unchanged.
     */
    @FunctionalInterface
    public interface MeasuredTask<T, E extends Exception> {
        T call() throws E;
    }

    private final OperatingSystemMXBean osBean;
    private final MemoryMXBean memoryBean;

    public ResourceSampler() {
        this(ManagementFactory.getOperatingSystemMXBean(), ManagementFactory.getMemoryMXBean());
    }

    ResourceSampler(final OperatingSystemMXBean osBean, final MemoryMXBean memoryBean) {
        this.osBean = osBean;
        this.memoryBean = memoryBean;
    }

    public ResourceSnapshot snapshot() {
        return new ResourceSnapshot(System.nanoTime(), processCpuNanos(), residentMemoryBytes());
    }

    public <T, E extends Exception> Measured<T> measure(final MeasuredTask<T, E> task) throws E {
        final ResourceSnapshot before = snapshot();
        final T result = task.call();
        final ResourceSnapshot after = snapshot();
        return new Measured<>(result, before.deltaTo(after));
    }

    public SystemInfo systemInfo() {
        final int cpuCount = Runtime.getRuntime().availableProcessors();
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            final double load = sunBean.getCpuLoad();
            return new SystemInfo(cpuCount, load < 0 ? -1.0 : load * 100.0,
                    sunBean.getTotalMemorySize(), sunBean.getFreeMemorySize());
        }
        final Runtime runtime = Runtime.getRuntime();
        return new SystemInfo(cpuCount, -1.0, runtime.maxMemory(), runtime.maxMemory() - usedHeapBytes(runtime));
    }

    private long processCpuNanos() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            final long cpu = sunBean.getProcessCpuTime();
            return Math.max(0L, cpu);
        }
        return 0L;
    }

    private long residentMemoryBytes() {
        return memoryBean.getHeapMemoryUsage().getUsed() + memoryBean.getNonHeapMemoryUsage().getUsed();
    }

    private static long usedHeapBytes(final Runtime runtime) {
        return runtime.totalMemory() - runtime.freeMemory();
    }
}

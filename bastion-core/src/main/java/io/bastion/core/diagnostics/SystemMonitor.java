package io.bastion.core.diagnostics;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.lang.management.OperatingSystemMXBean;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Samples process and host resource usage from the platform management beans.
 * Percentages are in the range 0-100; a value of -1 means the platform did not report it.
 */
public class SystemMonitor {

    public static final String CPU_PERCENT = "cpu_percent";
    public static final String MEMORY_PERCENT = "memory_percent";
    public static final String DISK_PERCENT = "disk_percent";
    public static final String THREADS = "threads";
    public static final String OPEN_FILES = "open_files";

    private final File diskRoot;

    public SystemMonitor() {
        this(new File("/"));
    }

    public SystemMonitor(File diskRoot) {
        this.diskRoot = diskRoot;
    }

    public Map<String, Double> sample() {
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put(CPU_PERCENT, cpuPercent());
        metrics.put(MEMORY_PERCENT, memoryPercent());
        metrics.put(DISK_PERCENT, diskPercent());
        metrics.put(THREADS, (double) ManagementFactory.getThreadMXBean().getThreadCount());
        metrics.put(OPEN_FILES, openFiles());
        return metrics;
    }

    protected double cpuPercent() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean) {
            double load = ((com.sun.management.OperatingSystemMXBean) os).getCpuLoad();
            if (load >= 0) {
                return load * 100.0;
            }
        }
        double average = os.getSystemLoadAverage();
        if (average < 0) {
            return -1;
        }
        return Math.min(100.0, average / os.getAvailableProcessors() * 100.0);
    }

    protected double memoryPercent() {
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        long max = heap.getMax() > 0 ? heap.getMax() : heap.getCommitted();
        if (max <= 0) {
            return -1;
        }
        return heap.getUsed() * 100.0 / max;
    }

    protected double diskPercent() {
        long total = diskRoot.getTotalSpace();
        if (total <= 0) {
            return -1;
        }
        return (total - diskRoot.getUsableSpace()) * 100.0 / total;
    }

    protected double openFiles() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.UnixOperatingSystemMXBean) {
            return ((com.sun.management.UnixOperatingSystemMXBean) os).getOpenFileDescriptorCount();
        }
        return -1;
    }
}

package com.chicu.airetrain.guard;

import org.springframework.stereotype.Component;

import java.io.File;
import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * CPU процесса (если JVM отдаёт), занятый heap, занятость диска рабочего каталога.
 */
@Component
public class JvmResourceProbe implements ResourceProbe {

    private final File workDir = new File(".").getAbsoluteFile();

    @Override
    public ResourceUsage sample() {
        return new ResourceUsage(cpu(), memory(), disk());
    }

    private static double cpu() {
        OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
        if (os instanceof com.sun.management.OperatingSystemMXBean sun) {
            return sun.getProcessCpuLoad();
        }
        return -1;
    }

    private static double memory() {
        Runtime rt = Runtime.getRuntime();
        long max = rt.maxMemory();
        if (max <= 0 || max == Long.MAX_VALUE) return -1;
        long used = rt.totalMemory() - rt.freeMemory();
        return (double) used / max;
    }

    private double disk() {
        long total = workDir.getTotalSpace();
        if (total <= 0) return -1;
        return 1.0 - (double) workDir.getUsableSpace() / total;
    }
}

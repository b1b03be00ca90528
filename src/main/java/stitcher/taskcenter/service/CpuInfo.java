package stitcher.taskcenter.service;

/**
 * Host CPU summary with recommended concurrency settings.
 */
public record CpuInfo(int cores, int recommendedConcurrency, int recommendedThreads) {

    public static CpuInfo forCores(int cores) {
        int safeCores = Math.max(1, cores);
        return new CpuInfo(
                safeCores,
                Math.max(1, safeCores / 4),
                Math.max(1, Math.min(safeCores - 1, 8)));
    }

    public static CpuInfo current() {
        return forCores(Runtime.getRuntime().availableProcessors());
    }
}

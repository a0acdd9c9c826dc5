package com.github.ytdle.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;

@Slf4j
@UtilityClass
public class ProcessUtils {

    /**
     * Kill a process and everything it spawned (ffmpeg, aria2c).
     */
    public static void destroyTree(Process process) {
        if (process == null) {
            return;
        }
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    /**
     * Wait for a process to exit, killing it if it outlives the timeout.
     *
     * @return exit code, or null if the process had to be killed
     */
    public static Integer awaitExit(Process process, long timeout, TimeUnit unit) throws InterruptedException {
        if (process.waitFor(timeout, unit)) {
            return process.exitValue();
        }
        log.warn("Process {} did not exit within {} {}, killing it", process.pid(), timeout, unit);
        destroyTree(process);
        process.waitFor(timeout, unit);
        return null;
    }
}

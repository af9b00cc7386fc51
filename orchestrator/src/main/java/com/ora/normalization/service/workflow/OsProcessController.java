package com.ora.normalization.service.workflow;

import com.ora.normalization.config.MigrationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Controls workflows as operating system processes, found by matching their command lines.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OsProcessController implements ProcessController {

    private final MigrationProperties properties;

    @Override
    public List<String> running(List<String> names) {
        List<String> running = new ArrayList<>();
        for (String name : names) {
            if (!matching(workflowPattern(name)).isEmpty()) {
                running.add(name);
            }
        }
        return running;
    }

    @Override
    public ProcessControlResult pause(List<String> names) {
        Duration grace = properties.getWorkflows().getGracePeriod();
        List<String> stopped = new ArrayList<>();

        for (String name : names) {
            List<ProcessHandle> processes = matching(workflowPattern(name));
            if (processes.isEmpty()) {
                log.info("Workflow {} is not running", name);
                continue;
            }
            log.info("Stopping workflow {} ({} processes)", name, processes.size());
            processes.forEach(ProcessHandle::destroy);
            stopped.add(name);
        }
        if (stopped.isEmpty()) {
            return ProcessControlResult.success(stopped, "no workflows were running");
        }

        sleep(grace);
        List<String> remaining = running(stopped);
        if (!remaining.isEmpty()) {
            log.warn("Workflows still running after {}s, forcing: {}", grace.toSeconds(), remaining);
            for (String name : remaining) {
                matching(workflowPattern(name)).forEach(ProcessHandle::destroyForcibly);
            }
            sleep(grace);
            remaining = running(remaining);
        }

        if (!remaining.isEmpty()) {
            return ProcessControlResult.failure(remaining, "workflows could not be stopped: " + remaining);
        }
        return ProcessControlResult.success(stopped, "stopped " + stopped.size() + " workflows");
    }

    @Override
    public ProcessControlResult resume() {
        List<String> command = properties.getWorkflows().getSupervisorCommand();
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            pb.redirectError(ProcessBuilder.Redirect.DISCARD);
            pb.redirectInput(ProcessBuilder.Redirect.from(new File(nullDevice())));
            Process process = pb.start();
            log.info("Started workflow supervisor (pid {}): {}", process.pid(), String.join(" ", command));
            return ProcessControlResult.success(List.of(String.valueOf(process.pid())), "supervisor started");
        } catch (IOException e) {
            log.warn("Could not start workflow supervisor {}: {}", command, e.getMessage());
            return ProcessControlResult.failure(List.of(), "supervisor did not start: " + e.getMessage());
        }
    }

    @Override
    public ProcessControlResult stopAll() {
        Pattern pattern = Pattern.compile(properties.getWorkflows().getStopAllPattern());
        Duration grace = properties.getWorkflows().getGracePeriod();
        List<ProcessHandle> processes = matching(pattern);
        if (processes.isEmpty()) {
            return ProcessControlResult.success(List.of(), "no workflow processes running");
        }
        processes.forEach(p -> terminate(p, false));
        sleep(grace);

        List<ProcessHandle> forced = matching(pattern);
        if (!forced.isEmpty()) {
            log.warn("{} workflow processes still running after {}s, forcing", forced.size(), grace.toSeconds());
            forced.forEach(p -> terminate(p, true));
            sleep(grace);
        }

        List<String> survivors = pids(matching(pattern));
        if (!survivors.isEmpty()) {
            log.error("Workflow processes survived forced termination: {}", survivors);
            return ProcessControlResult.failure(survivors, "processes survived forced termination: " + survivors);
        }
        List<String> pids = pids(processes);
        log.info("Stopped {} workflow processes ({} forced)", processes.size(), forced.size());
        return ProcessControlResult.success(pids, "stopped " + pids.size() + " processes");
    }

    private Pattern workflowPattern(String name) {
        return Pattern.compile(properties.getWorkflows().getInterpreterPattern() + ".*" + Pattern.quote(name));
    }

    List<ProcessHandle> matching(Pattern pattern) {
        long self = ProcessHandle.current().pid();
        return ProcessHandle.allProcesses()
            .filter(ProcessHandle::isAlive)
            .filter(p -> p.pid() != self)
            .filter(p -> p.info().commandLine().map(cmd -> pattern.matcher(cmd).find()).orElse(false))
            .toList();
    }

    void terminate(ProcessHandle process, boolean forcibly) {
        if (forcibly) {
            process.destroyForcibly();
        } else {
            process.destroy();
        }
    }

    private static List<String> pids(List<ProcessHandle> processes) {
        return processes.stream().map(p -> String.valueOf(p.pid())).toList();
    }

    private static String nullDevice() {
        return System.getProperty("os.name").toLowerCase().contains("windows") ? "NUL" : "/dev/null";
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}

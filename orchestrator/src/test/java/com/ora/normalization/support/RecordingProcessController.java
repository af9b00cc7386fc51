package com.ora.normalization.support;

import com.ora.normalization.service.workflow.ProcessControlResult;
import com.ora.normalization.service.workflow.ProcessController;

import java.util.ArrayList;
import java.util.List;

/**
 * Process controller that records calls and fails on demand.
 */
public class RecordingProcessController implements ProcessController {

    private final List<String> calls = new ArrayList<>();
    private boolean pauseFails;
    private boolean resumeFails;
    private boolean stopAllFails;
    private List<String> running = List.of();

    public RecordingProcessController failPause() {
        this.pauseFails = true;
        return this;
    }

    public RecordingProcessController failResume() {
        this.resumeFails = true;
        return this;
    }

    public RecordingProcessController failStopAll() {
        this.stopAllFails = true;
        return this;
    }

    public RecordingProcessController withRunning(List<String> running) {
        this.running = List.copyOf(running);
        return this;
    }

    public void reset() {
        calls.clear();
        pauseFails = false;
        resumeFails = false;
        stopAllFails = false;
        running = List.of();
    }

    public List<String> getCalls() {
        return List.copyOf(calls);
    }

    @Override
    public List<String> running(List<String> names) {
        calls.add("running");
        return running.stream().filter(names::contains).toList();
    }

    @Override
    public ProcessControlResult pause(List<String> names) {
        calls.add("pause");
        if (pauseFails) {
            return ProcessControlResult.failure(names, "processes survived forced termination");
        }
        return ProcessControlResult.success(names, "stopped " + names.size() + " workflows");
    }

    @Override
    public ProcessControlResult resume() {
        calls.add("resume");
        if (resumeFails) {
            return ProcessControlResult.failure(List.of(), "start_all.sh not found");
        }
        return ProcessControlResult.success(List.of(), "supervisor started");
    }

    @Override
    public ProcessControlResult stopAll() {
        calls.add("stopAll");
        if (stopAllFails) {
            return ProcessControlResult.failure(List.of("4242"), "processes survived forced termination: [4242]");
        }
        return ProcessControlResult.success(List.of(), "no workflow processes running");
    }
}

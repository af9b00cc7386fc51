package com.ora.normalization.service.workflow;

import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Controller for runs against a disposable copy: no real workflow is ever touched.
 */
@Slf4j
public class NoOpProcessController implements ProcessController {

    @Override
    public List<String> running(List<String> names) {
        return List.of();
    }

    @Override
    public ProcessControlResult pause(List<String> names) {
        log.debug("Not pausing {} (disposable copy)", names);
        return ProcessControlResult.success(List.of(), "no workflows controlled in test mode");
    }

    @Override
    public ProcessControlResult resume() {
        return ProcessControlResult.success(List.of(), "no workflows controlled in test mode");
    }

    @Override
    public ProcessControlResult stopAll() {
        return ProcessControlResult.success(List.of(), "no workflows controlled in test mode");
    }
}

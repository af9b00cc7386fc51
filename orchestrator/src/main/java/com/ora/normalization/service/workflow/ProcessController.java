package com.ora.normalization.service.workflow;

import java.util.List;

/**
 * Controls the external ingestion workflows that write to the store.
 */
public interface ProcessController {

    /**
     * Names of the given workflows that currently have a live process.
     */
    List<String> running(List<String> names);

    /**
     * Stop every process of the given workflows, escalating to a forced kill once.
     */
    ProcessControlResult pause(List<String> names);

    /**
     * Relaunch the workflow supervisor.
     */
    ProcessControlResult resume();

    /**
     * Stop every workflow process, named or not. Used before a restore.
     */
    ProcessControlResult stopAll();
}

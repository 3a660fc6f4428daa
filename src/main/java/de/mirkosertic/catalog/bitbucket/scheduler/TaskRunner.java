package de.mirkosertic.catalog.bitbucket.scheduler;

/**
 * Runs a task according to some schedule. Implementations guarantee that a task id never
 * executes more than once at the same time.
 */
public interface TaskRunner {

    void run(TaskInvocationDefinition task);
}

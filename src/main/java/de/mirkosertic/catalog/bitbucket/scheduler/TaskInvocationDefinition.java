package de.mirkosertic.catalog.bitbucket.scheduler;

/**
 * A named unit of work handed to a {@link TaskRunner}.
 */
public record TaskInvocationDefinition(
        String id,
        TaskFunction fn
) {

    @FunctionalInterface
    public interface TaskFunction {
        void run() throws Exception;
    }
}

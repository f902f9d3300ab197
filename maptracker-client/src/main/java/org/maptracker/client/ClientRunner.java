package org.maptracker.client;

import org.maptracker.merge.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one map tracker tool and maps its outcome to a process exit status:
 * {@value #SUCCESS} when the tool returns normally and {@value #FAILURE} when it throws.
 * Each tool's main method wraps its work in an anonymous subclass.
 */
public abstract class ClientRunner {

    public static final int SUCCESS = 0;
    public static final int FAILURE = 1;

    private final String toolName;
    private final String[] args;

    public ClientRunner(final Class<?> toolClass,
                        final String[] args) {
        this.toolName = toolClass.getSimpleName();
        this.args = args;
    }

    /**
     * Runs the tool and exits the JVM with its status.
     */
    public void run() {
        System.exit(execute());
    }

    /**
     * @return exit status for the tool run.
     */
    public int execute() {

        LOG.info("execute: starting {}", toolName);

        final ProcessTimer processTimer = new ProcessTimer();

        int status = SUCCESS;
        try {
            runClient(args);
            LOG.info("execute: {} finished after {}", toolName, processTimer);
        } catch (final Throwable t) {
            LOG.error("execute: {} failed after {}", toolName, processTimer, t);
            status = FAILURE;
        }

        return status;
    }

    public abstract void runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}

package com.mass.simulator.agent;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.util.StatusPrinter;
import com.google.common.annotations.VisibleForTesting;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Entry point of the simulator. The only argument is the home directory holding
 * <code>config.properties</code> and an optional <code>logback.xml</code>; it defaults to the
 * working directory.
 */
public class AgentLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(AgentLoader.class);

    static final String LOGBACK_FILE = "logback.xml";
    static final String LOGS_DIR = "logs";

    public static void main(String[] args) {
        String homePath = resolveHomePath(args);
        LOGGER.info("MASS simulator starting from {}", homePath);
        configureLogging(homePath);

        try {
            new Agent().start(homePath);
        } catch (Throwable e) {
            LOGGER.error("Unable to start agent.", e);
            System.exit(1);
        }
    }

    @VisibleForTesting
    static String resolveHomePath(String[] args) {
        return args.length > 0 && !args[0].trim().isEmpty() ? args[0] : System.getProperty("user.dir");
    }

    /**
     * Replace the bundled logging setup with <code>home/logback.xml</code> when there is one. The
     * <code>logDir</code> property points at <code>home/logs</code>.
     *
     * @param homePath
     */
    private static void configureLogging(String homePath) {
        File logback = new File(homePath, LOGBACK_FILE);
        if (!logback.isFile()) {
            return;
        }

        File logsDir = new File(homePath, LOGS_DIR);
        if (!logsDir.isDirectory() && !logsDir.mkdirs()) {
            LOGGER.warn("unable to create log directory {}", logsDir);
        }
        LOGGER.info("reconfiguring logging from {}", logback);

        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        context.putProperty("logDir", logsDir.getAbsolutePath());
        try {
            configurator.doConfigure(logback);
        } catch (JoranException je) {
            // the status printer below reports the details
            LOGGER.error("invalid logging configuration {}", logback);
        }
        StatusPrinter.printInCaseOfErrorsOrWarnings(context);
    }
}

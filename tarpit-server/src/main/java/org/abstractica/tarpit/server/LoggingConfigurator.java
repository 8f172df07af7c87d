package org.abstractica.tarpit.server;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Maps the {@code -v} count onto the Logback root level.
 *
 * <p>0 logs errors only, 1 adds connection events at info, 2 or more
 * enables debug output.</p>
 */
public final class LoggingConfigurator
{
    private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(LoggingConfigurator.class);

    private LoggingConfigurator()
    {
    }

    /**
     * Returns the root level for a verbosity count.
     *
     * @param verbosity number of {@code -v} flags
     * @return the level
     */
    public static Level levelFor(int verbosity)
    {
        if (verbosity <= 0)
        {
            return Level.ERROR;
        }
        return verbosity == 1 ? Level.INFO : Level.DEBUG;
    }

    /**
     * Sets the root logger level.
     *
     * @param verbosity number of {@code -v} flags
     */
    public static void configure(int verbosity)
    {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (factory instanceof LoggerContext context)
        {
            Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
            root.setLevel(levelFor(verbosity));
            return;
        }
        LOG.warn("Verbosity {} requested but backend {} does not support dynamic level updates",
                verbosity, factory.getClass().getName());
    }
}

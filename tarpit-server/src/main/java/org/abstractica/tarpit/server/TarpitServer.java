package org.abstractica.tarpit.server;

import org.abstractica.tarpit.Tarpit;
import org.abstractica.tarpit.TarpitBindException;
import org.abstractica.tarpit.impl.session.DefaultTarpitFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point of the tarpit.
 *
 * <p>Parses the options, sets the log level, starts the tarpit and the
 * optional metrics endpoint, and runs until the JVM is asked to shut down.</p>
 *
 * <p>Exit codes follow sysexits: 64 for bad arguments, 71 when a listener
 * cannot be bound.</p>
 */
public class TarpitServer
{
    private static final Logger LOG = LoggerFactory.getLogger(TarpitServer.class);

    static final int EX_OK = 0;
    static final int EX_USAGE = 64;
    static final int EX_OSERR = 71;

    private final TarpitArguments arguments;
    private final CountDownLatch shutdown = new CountDownLatch(1);

    private Tarpit tarpit;
    private MetricsEndpoint metricsEndpoint;

    public TarpitServer(TarpitArguments arguments)
    {
        this.arguments = arguments;
    }

    /**
     * Starts the tarpit and, if configured, the metrics endpoint.
     *
     * @return {@link #EX_OK}, or {@link #EX_OSERR} if a listener cannot be bound
     */
    int start()
    {
        tarpit = arguments.applyTo(new DefaultTarpitFactory().builder()).build();
        try
        {
            tarpit.start();
        }
        catch (TarpitBindException e)
        {
            LOG.error(e.getMessage());
            return EX_OSERR;
        }

        // No process sandbox on the JVM
        LOG.info("sandbox mode, enabled: {}", false);

        if (arguments.getMetricsAddress() != null)
        {
            metricsEndpoint = new MetricsEndpoint(arguments.getMetricsAddress(), tarpit::exportMetrics);
            try
            {
                metricsEndpoint.start();
            }
            catch (Exception e)
            {
                LOG.error("bind(), addr: {}, error: {}", arguments.getMetricsAddress(), e.getMessage());
                stop();
                return EX_OSERR;
            }
        }

        return EX_OK;
    }

    /**
     * Stops the metrics endpoint and the tarpit and releases {@link #await()}.
     */
    void stop()
    {
        if (metricsEndpoint != null)
        {
            metricsEndpoint.close();
        }
        if (tarpit != null)
        {
            tarpit.close();
        }
        shutdown.countDown();
    }

    /**
     * Blocks until {@link #stop()} has been called.
     */
    void await() throws InterruptedException
    {
        shutdown.await();
    }

    Tarpit getTarpit()
    {
        return tarpit;
    }

    MetricsEndpoint getMetricsEndpoint()
    {
        return metricsEndpoint;
    }

    /**
     * Runs the server with the given arguments.
     *
     * @param args command-line arguments
     * @return the process exit code
     */
    static int run(String[] args)
    {
        TarpitArguments arguments;
        try
        {
            arguments = TarpitArguments.parse(args);
        }
        catch (IllegalArgumentException e)
        {
            System.err.println(e.getMessage());
            System.err.println(TarpitArguments.usage());
            return EX_USAGE;
        }

        if (arguments.isHelp())
        {
            System.out.println(TarpitArguments.usage());
            return EX_OK;
        }

        LoggingConfigurator.configure(arguments.getVerbosity());

        TarpitServer server = new TarpitServer(arguments);
        int status = server.start();
        if (status != EX_OK)
        {
            return status;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "tarpit-shutdown"));

        try
        {
            server.await();
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            server.stop();
        }
        return EX_OK;
    }

    public static void main(String[] args)
    {
        int status = run(args);
        // Exiting from inside a shutdown hook would block, so only exit on failure
        if (status != EX_OK)
        {
            System.exit(status);
        }
    }
}

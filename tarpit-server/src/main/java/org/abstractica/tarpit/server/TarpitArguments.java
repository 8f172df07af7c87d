package org.abstractica.tarpit.server;

import org.abstractica.tarpit.TarpitFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Command-line options of the tarpit server.
 *
 * <p>Accepts {@code -x value}, {@code --long value} and {@code --long=value}
 * forms. {@code -v} may be repeated or combined ({@code -vv}).</p>
 */
public final class TarpitArguments
{
    static final String DEFAULT_LISTEN = "0.0.0.0:2222";
    static final int DEFAULT_DELAY_SECONDS = 10;

    private InetSocketAddress listenAddress;
    private int maxClients = 0;
    private int delaySeconds = DEFAULT_DELAY_SECONDS;
    private int verbosity = 0;
    private InetSocketAddress metricsAddress;
    private int chunkSize = 0;
    private int eastereggInterval = 0;
    private boolean help;

    private TarpitArguments()
    {
    }

    /**
     * Parses command-line arguments.
     *
     * @param args the arguments
     * @return the parsed options
     * @throws IllegalArgumentException on an unknown option or a bad value
     */
    public static TarpitArguments parse(String... args)
    {
        Objects.requireNonNull(args, "args");

        TarpitArguments parsed = new TarpitArguments();
        parsed.listenAddress = parseAddress(DEFAULT_LISTEN, "--listen");

        for (int i = 0; i < args.length; i++)
        {
            String arg = args[i];
            String name = arg;
            String inlineValue = null;
            if (arg.startsWith("--") && arg.contains("="))
            {
                name = arg.substring(0, arg.indexOf('='));
                inlineValue = arg.substring(arg.indexOf('=') + 1);
            }

            if (arg.matches("-v+"))
            {
                parsed.verbosity += arg.length() - 1;
                continue;
            }

            switch (name)
            {
                case "-h", "--help" -> parsed.help = true;
                case "--verbose" -> parsed.verbosity++;
                case "-l", "--listen" ->
                {
                    String value = inlineValue != null ? inlineValue : valueAt(args, ++i, name);
                    parsed.listenAddress = parseAddress(value, name);
                }
                case "-c", "--max-clients" ->
                {
                    String value = inlineValue != null ? inlineValue : valueAt(args, ++i, name);
                    parsed.maxClients = parsePositive(value, name);
                }
                case "-d", "--delay" ->
                {
                    String value = inlineValue != null ? inlineValue : valueAt(args, ++i, name);
                    parsed.delaySeconds = parsePositive(value, name);
                }
                case "--metrics-listen" ->
                {
                    String value = inlineValue != null ? inlineValue : valueAt(args, ++i, name);
                    parsed.metricsAddress = parseAddress(value, name);
                }
                case "--chunk-size" ->
                {
                    String value = inlineValue != null ? inlineValue : valueAt(args, ++i, name);
                    parsed.chunkSize = parsePositive(value, name);
                }
                case "--easteregg-interval" ->
                {
                    String value = inlineValue != null ? inlineValue : valueAt(args, ++i, name);
                    parsed.eastereggInterval = parseNonNegative(value, name);
                }
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        return parsed;
    }

    /**
     * Returns the usage text.
     */
    public static String usage()
    {
        return String.join(System.lineSeparator(),
                "Usage: tarpit [options]",
                "",
                "A TCP tarpit server",
                "",
                "Options:",
                "  -l, --listen <addr>          Listen address to bind to (default " + DEFAULT_LISTEN + ")",
                "  -c, --max-clients <n>        Best-effort connection limit (default unlimited)",
                "  -d, --delay <seconds>        Seconds between responses (default " + DEFAULT_DELAY_SECONDS + ")",
                "  -v, --verbose                Verbose level (repeat for more verbosity)",
                "      --metrics-listen <addr>  Serve metrics on http://<addr>/metrics",
                "      --chunk-size <bytes>     Banner bytes per response (default whole banner)",
                "      --easteregg-interval <n> Banners between easter eggs (default 0, never)",
                "  -h, --help                   Show this help");
    }

    /**
     * Copies the tarpit options into a builder.
     *
     * @param builder the builder to configure
     * @return the same builder
     */
    public TarpitFactory.Builder applyTo(TarpitFactory.Builder builder)
    {
        return builder
                .listenAddress(listenAddress)
                .maxClients(maxClients)
                .delay(Duration.ofSeconds(delaySeconds))
                .chunkSize(chunkSize)
                .eastereggInterval(eastereggInterval);
    }

    public InetSocketAddress getListenAddress()
    {
        return listenAddress;
    }

    /**
     * Returns the connection limit, 0 meaning unlimited.
     */
    public int getMaxClients()
    {
        return maxClients;
    }

    public int getDelaySeconds()
    {
        return delaySeconds;
    }

    public int getVerbosity()
    {
        return verbosity;
    }

    /**
     * Returns the metrics endpoint address, or null if disabled.
     */
    public InetSocketAddress getMetricsAddress()
    {
        return metricsAddress;
    }

    public int getChunkSize()
    {
        return chunkSize;
    }

    public int getEastereggInterval()
    {
        return eastereggInterval;
    }

    public boolean isHelp()
    {
        return help;
    }

    // ========== Parsing Helpers ==========

    private static String valueAt(String[] args, int index, String name)
    {
        if (index >= args.length)
        {
            throw new IllegalArgumentException("Missing value for " + name);
        }
        return args[index];
    }

    /**
     * Parses {@code host:port}; IPv6 hosts are written in brackets.
     */
    static InetSocketAddress parseAddress(String value, String name)
    {
        int colon = value.lastIndexOf(':');
        if (colon <= 0 || colon == value.length() - 1)
        {
            throw new IllegalArgumentException("Invalid address for " + name + ": " + value);
        }

        String host = value.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]"))
        {
            host = host.substring(1, host.length() - 1);
        }

        int port;
        try
        {
            port = Integer.parseInt(value.substring(colon + 1));
        }
        catch (NumberFormatException e)
        {
            throw new IllegalArgumentException("Invalid port for " + name + ": " + value, e);
        }
        if (port < 0 || port > 65535)
        {
            throw new IllegalArgumentException("Port must be 0-65535 for " + name + ": " + port);
        }

        InetSocketAddress address = new InetSocketAddress(host, port);
        if (address.isUnresolved())
        {
            throw new IllegalArgumentException("Cannot resolve host for " + name + ": " + host);
        }
        return address;
    }

    private static int parsePositive(String value, String name)
    {
        int parsed = parseNonNegative(value, name);
        if (parsed == 0)
        {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
        return parsed;
    }

    private static int parseNonNegative(String value, String name)
    {
        int parsed;
        try
        {
            parsed = Integer.parseInt(value);
        }
        catch (NumberFormatException e)
        {
            throw new IllegalArgumentException("Invalid number for " + name + ": " + value, e);
        }
        if (parsed < 0)
        {
            throw new IllegalArgumentException(name + " must be >= 0: " + value);
        }
        return parsed;
    }
}

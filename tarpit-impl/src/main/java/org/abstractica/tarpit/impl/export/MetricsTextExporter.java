package org.abstractica.tarpit.impl.export;

import org.abstractica.tarpit.impl.registry.ConnectionStats;
import org.abstractica.tarpit.impl.registry.MetricsSnapshot;

import java.util.Objects;

/**
 * Renders a {@link MetricsSnapshot} as a Prometheus-style text document.
 *
 * <p>The layout is fixed: metric names, label sets and ordering are identical
 * on every call, only values change. Scalar metrics are written as</p>
 * <pre>
 * # HELP name description
 * # TYPE name type
 * name value
 * </pre>
 * <p>followed by a blank line. Each of the three populations ends with a
 * histogram of 32 {@code name{le=Ns} count} lines, where each bucket counts
 * only its own range. Populations are separated by a blank line.</p>
 */
public class MetricsTextExporter
{
    /**
     * Content type for scrapers of this format.
     */
    public static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private static final int EXPECTED_SIZE = 16 * 1024;

    /**
     * A group of connections reported under one name prefix.
     */
    private enum Population
    {
        CLIENT("client", "by current clients", "of current clients"),
        FORMER("former", "by former clients", "of former clients"),
        TOTAL("total", "overall", "overall");

        private final String prefix;
        private final String by;
        private final String of;

        Population(String prefix, String by, String of)
        {
            this.prefix = prefix;
            this.by = by;
            this.of = of;
        }
    }

    /**
     * Renders the snapshot.
     *
     * @param snapshot the statistics to render
     * @return the metrics document
     */
    public String export(MetricsSnapshot snapshot)
    {
        Objects.requireNonNull(snapshot, "snapshot");

        StringBuilder sb = new StringBuilder(EXPECTED_SIZE);
        appendMetric(sb, "uptime_seconds", "gauge",
                "Number of seconds since startup.", snapshot.uptimeSeconds());
        appendMetric(sb, "connections_count", "counter",
                "Number of current connections.", snapshot.connectionsCount());
        appendMetric(sb, "connections_total", "counter",
                "Total number of connections.", snapshot.connectionsTotal());

        appendPopulation(sb, Population.CLIENT, snapshot.current());
        sb.append('\n');
        appendPopulation(sb, Population.FORMER, snapshot.former());
        sb.append('\n');
        appendPopulation(sb, Population.TOTAL, snapshot.total());
        return sb.toString();
    }

    private static void appendPopulation(StringBuilder sb, Population population, ConnectionStats stats)
    {
        String p = population.prefix;
        appendMetric(sb, p + "_maximum_connection_time_seconds", "counter",
                "Length in seconds of longest connection " + population.by + ".",
                stats.getMaximumConnectionTime());
        appendMetric(sb, p + "_minimum_connection_time_seconds", "counter",
                "Length in seconds of shortest connection " + population.by + ".",
                stats.getMinimumConnectionTime());
        appendMetric(sb, p + "_sent_chunks_sum", "counter",
                "Sum of sent chunks " + population.by + ".",
                stats.getSentChunksSum());
        appendMetric(sb, p + "_sent_eastereggs_sum", "counter",
                "Sum of sent eastereggs " + population.by + ".",
                stats.getSentEastereggsSum());
        appendMetric(sb, p + "_sent_banners_sum", "counter",
                "Sum of sent banners " + population.by + ".",
                stats.getSentBannersSum());
        appendMetric(sb, p + "_connection_time_seconds_sum", "counter",
                "Sum of connection time " + population.of + ".",
                stats.getConnectionTimeSum());
        appendHistogram(sb, p + "_connection_time_seconds_bucket",
                "A histogram of the connection time " + population.of + ".",
                stats);
    }

    private static void appendHeader(StringBuilder sb, String name, String type, String help)
    {
        sb.append("# HELP ").append(name).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(name).append(' ').append(type).append('\n');
    }

    private static void appendMetric(StringBuilder sb, String name, String type, String help, long value)
    {
        appendHeader(sb, name, type, help);
        sb.append(name).append(' ').append(value).append("\n\n");
    }

    private static void appendHistogram(StringBuilder sb, String name, String help, ConnectionStats stats)
    {
        appendHeader(sb, name, "histogram", help);
        for (int i = 0; i < ConnectionStats.BUCKET_COUNT; i++)
        {
            sb.append(name)
                    .append("{le=").append(ConnectionStats.upperBound(i)).append("s} ")
                    .append(stats.getBucket(i))
                    .append('\n');
        }
    }
}

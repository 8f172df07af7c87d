package org.abstractica.tarpit.server;

import org.abstractica.tarpit.impl.export.MetricsTextExporter;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.server.handler.AbstractHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * HTTP endpoint serving the metrics text to pull-based scrapers.
 *
 * <p>Answers {@code GET /metrics}; every other path is 404. Each request
 * renders a fresh snapshot.</p>
 */
public class MetricsEndpoint implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(MetricsEndpoint.class);

    static final String PATH = "/metrics";

    private final Server server;
    private final InetSocketAddress address;

    /**
     * Creates an endpoint; nothing is bound until {@link #start()}.
     *
     * @param address where to listen
     * @param metrics renders the current metrics text
     */
    public MetricsEndpoint(InetSocketAddress address, Supplier<String> metrics)
    {
        this.address = Objects.requireNonNull(address, "address");
        this.server = new Server(address);
        this.server.setHandler(new MetricsHandler(Objects.requireNonNull(metrics, "metrics")));
    }

    /**
     * Binds the listener and starts serving.
     *
     * @throws Exception if Jetty fails to start, typically on a bind failure
     */
    public void start() throws Exception
    {
        server.start();
        LOG.info("metrics, addr: {}, path: {}", address, PATH);
    }

    /**
     * Returns the bound port, useful when started on port 0.
     */
    public int getPort()
    {
        return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
    }

    @Override
    public void close()
    {
        try
        {
            server.stop();
        }
        catch (Exception e)
        {
            LOG.warn("Error stopping metrics endpoint", e);
        }
    }

    private static class MetricsHandler extends AbstractHandler
    {
        private final Supplier<String> metrics;

        MetricsHandler(Supplier<String> metrics)
        {
            this.metrics = metrics;
        }

        @Override
        public void handle(
                String target,
                Request baseRequest,
                HttpServletRequest request,
                HttpServletResponse response
        ) throws IOException
        {
            baseRequest.setHandled(true);

            if (!PATH.equals(target))
            {
                response.sendError(HttpServletResponse.SC_NOT_FOUND);
                return;
            }
            if (!"GET".equals(request.getMethod()))
            {
                response.setStatus(HttpServletResponse.SC_METHOD_NOT_ALLOWED);
                response.setHeader("Allow", "GET");
                return;
            }

            byte[] body = metrics.get().getBytes(StandardCharsets.UTF_8);
            response.setStatus(HttpServletResponse.SC_OK);
            response.setContentType(MetricsTextExporter.CONTENT_TYPE);
            response.setContentLength(body.length);
            response.getOutputStream().write(body);
            LOG.debug("metrics scraped, peer: {}, bytes: {}", request.getRemoteAddr(), body.length);
        }
    }
}

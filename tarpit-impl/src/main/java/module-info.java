/**
 * Tarpit implementation module.
 *
 * <p>Provides the default implementation of the tarpit API.</p>
 */
module tarpit.impl
{
    requires tarpit.api;
    requires org.slf4j;

    // Export factory implementation for external use
    exports org.abstractica.tarpit.impl.session;

    // Export registry and exporter for embedding the statistics elsewhere
    exports org.abstractica.tarpit.impl.registry;
    exports org.abstractica.tarpit.impl.export;
}

/**
 * Tarpit API module.
 *
 * <p>Provides interfaces for running a TCP tarpit and reading its
 * connection statistics.</p>
 */
module tarpit.api
{
    exports org.abstractica.tarpit;
}

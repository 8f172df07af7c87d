package org.abstractica.tarpit.impl.registry;

/**
 * Thrown when a token does not name a live connection.
 *
 * <p>Only a logic fault can cause this, such as disconnecting the same
 * connection twice. The registry is left unchanged.</p>
 */
public class TokenException extends Exception
{
    /**
     * Why the token was refused.
     */
    public enum Reason
    {
        /**
         * The slot index was never handed out.
         */
        INVALID_TOKEN,

        /**
         * The slot exists but its connection is already gone.
         */
        ALREADY_DISCONNECTED
    }

    private final Reason reason;
    private final Token token;

    public TokenException(Reason reason, Token token)
    {
        super(describe(reason) + ": slot " + token.index());
        this.reason = reason;
        this.token = token;
    }

    public Reason getReason()
    {
        return reason;
    }

    public Token getToken()
    {
        return token;
    }

    private static String describe(Reason reason)
    {
        return switch (reason)
        {
            case INVALID_TOKEN -> "Invalid token";
            case ALREADY_DISCONNECTED -> "Already disconnected";
        };
    }
}

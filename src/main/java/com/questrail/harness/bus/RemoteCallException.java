package com.questrail.harness.bus;

import java.util.Objects;

/**
 * Error reply to a bus method call.
 */
public class RemoteCallException extends Exception
{
    private final String errorName;
    private final String detail;

    public RemoteCallException(String errorName, String message)
    {
        this(errorName, message, null);
    }

    public RemoteCallException(String errorName, String message, Throwable cause)
    {
        super(errorName + ": " + message, cause);
        this.errorName = Objects.requireNonNull(errorName, "errorName");
        this.detail = message;
    }

    public String errorName()
    {
        return errorName;
    }

    /**
     * The message without the error name prefix.
     */
    public String detail()
    {
        return detail;
    }
}

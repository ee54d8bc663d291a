package com.questrail.harness.bus;

import java.util.Objects;

/**
 * Receiver-side signal filter. A {@code null} member matches every signal of
 * the interface on that path.
 */
public record SignalMatch(String path, String iface, String member)
{
    public SignalMatch {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(iface, "iface");
    }

    public static SignalMatch of(String path, String iface, String member)
    {
        return new SignalMatch(path, iface, member);
    }

    public boolean matches(String path, String iface, String member)
    {
        return this.path.equals(path)
                && this.iface.equals(iface)
                && (this.member == null || this.member.equals(member));
    }
}

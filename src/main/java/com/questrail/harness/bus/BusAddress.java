package com.questrail.harness.bus;

import java.net.InetSocketAddress;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bus address in the {@code tcp:host=<host>,port=<port>} form handed to
 * workers through {@link BusNames#BUS_ADDRESS_ENV}.
 */
public record BusAddress(String host, int port)
{
    private static final String TCP = "tcp:";

    public BusAddress {
        Objects.requireNonNull(host, "host");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    public static BusAddress parse(String address)
    {
        Objects.requireNonNull(address, "address");
        if (!address.startsWith(TCP)) {
            throw new IllegalArgumentException("Unsupported bus address transport: " + address);
        }

        Map<String, String> keys = new HashMap<>();
        for (String pair : address.substring(TCP.length()).split(",")) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Malformed bus address: " + address);
            }
            keys.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
        }

        String host = keys.get("host");
        String port = keys.get("port");
        if (host == null || port == null) {
            throw new IllegalArgumentException("Bus address needs host and port: " + address);
        }
        try {
            return new BusAddress(host, Integer.parseInt(port));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed bus port in " + address, e);
        }
    }

    public InetSocketAddress toSocketAddress()
    {
        return new InetSocketAddress(host, port);
    }

    @Override
    public String toString()
    {
        return TCP + "host=" + host + ",port=" + port;
    }
}

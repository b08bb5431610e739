package com.questrail.dtchat.transport.netty;

import com.questrail.dtchat.api.Endpoint;
import com.questrail.dtchat.api.TransportKind;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketAddress;

/**
 * Conversions between endpoint address text ({@code host:port},
 * {@code [v6]:port}) and socket addresses.
 */
final class SocketAddresses
{
    private SocketAddresses() {
    }

    static InetSocketAddress resolve(String address) {
        int colon = address.lastIndexOf(':');
        if (colon <= 0 || colon == address.length() - 1) {
            throw new IllegalArgumentException("Expected host:port, got '" + address + "'");
        }

        String host = address.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }

        int port;
        try {
            port = Integer.parseInt(address.substring(colon + 1));
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in '" + address + "'", e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range in '" + address + "'");
        }
        return new InetSocketAddress(host, port);
    }

    static Endpoint toEndpoint(TransportKind kind, SocketAddress address) {
        if (address instanceof InetSocketAddress inet) {
            InetAddress ip = inet.getAddress();
            String host = ip != null ? ip.getHostAddress() : inet.getHostString();
            if (host.indexOf(':') >= 0) {
                host = "[" + host + "]";
            }
            return new Endpoint(kind, host + ":" + inet.getPort());
        }
        return new Endpoint(kind, String.valueOf(address).replaceAll("\\s", ""));
    }
}

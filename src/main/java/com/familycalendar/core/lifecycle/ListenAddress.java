package com.familycalendar.core.lifecycle;

import java.net.Inet6Address;
import java.net.InetAddress;

/**
 * Human-readable description of the address the web server is bound to, so an operator can tell
 * at a glance who can reach the server.
 */
public final class ListenAddress {

    private ListenAddress() {
        // utility class
    }

    public static String describe(InetAddress address, int port) {
        String hostPort = hostPort(address, port);
        if (address.isAnyLocalAddress()) {
            return address instanceof Inet6Address
                    ? "Web server listening on all IPv6 interfaces (" + hostPort + "); reachable from any IPv6 network"
                    : "Web server listening on all IPv4 interfaces (" + hostPort + "); reachable from any network interface";
        }
        if (address.isLoopbackAddress()) {
            return "Web server listening on loopback (" + hostPort + "); only reachable from this machine";
        }
        if (isBroadcast(address)) {
            return "Web server listening on the broadcast address (" + hostPort + "); this is unusual";
        }
        if (address.isSiteLocalAddress()) {
            return "Web server listening on a private network address (" + hostPort + "); reachable from your LAN";
        }
        if (address.isLinkLocalAddress()) {
            return "Web server listening on a link-local address (" + hostPort + "); reachable from the local link only";
        }
        return "Web server listening on a specific address (" + hostPort + "); check your network configuration";
    }

    /**
     * URL a browser would use to reach the server.
     */
    public static String url(InetAddress address, int port) {
        if (address.isAnyLocalAddress()) {
            return "http://*:" + port;
        }
        if (address.isLoopbackAddress()) {
            return "http://localhost:" + port;
        }
        return "http://" + hostPort(address, port);
    }

    private static String hostPort(InetAddress address, int port) {
        String host = address.getHostAddress();
        return address instanceof Inet6Address ? "[" + host + "]:" + port : host + ":" + port;
    }

    private static boolean isBroadcast(InetAddress address) {
        byte[] octets = address.getAddress();
        if (octets.length != 4) {
            return false;
        }
        for (byte octet : octets) {
            if (octet != (byte) 0xFF) {
                return false;
            }
        }
        return true;
    }
}

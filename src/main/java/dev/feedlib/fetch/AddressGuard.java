package dev.feedlib.fetch;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Rejects fetch targets that resolve to non-public addresses before any request is sent.
 *
 * <p>A host is rejected when <em>any</em> of its resolved addresses is loopback, link-local,
 * private-range, carrier-grade NAT, multicast, documentation/benchmark space or otherwise not
 * globally routable. IPv4-mapped and NAT64 IPv6 addresses are judged by their embedded IPv4
 * address.
 */
@Component
public class AddressGuard {

    private static final Logger log = LoggerFactory.getLogger(AddressGuard.class);

    private final HostResolver resolver;

    public AddressGuard() {
        this(InetAddress::getAllByName);
    }

    AddressGuard(HostResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Resolves the URL's host and checks every address against the public-address policy.
     *
     * @param uri absolute http(s) URI
     * @throws FetchException with {@link FetchStatus#DNS_ERROR} if the host cannot be resolved,
     *     or {@link FetchStatus#PRIVATE_ADDRESS_ERROR} if an address is not public
     */
    void check(URI uri) {
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            throw new FetchException(FetchStatus.DNS_ERROR, "URL has no host: " + uri);
        }
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }

        InetAddress[] addresses;
        try {
            addresses = resolver.resolve(host);
        } catch (UnknownHostException e) {
            throw new FetchException(FetchStatus.DNS_ERROR, "Unable to resolve host " + host, e);
        }
        if (addresses == null || addresses.length == 0) {
            throw new FetchException(FetchStatus.DNS_ERROR, "No address for host " + host);
        }

        for (InetAddress address : addresses) {
            if (isPrivate(address)) {
                log.warn("Rejected {}: host {} resolves to non-public address {}",
                        uri, host, address.getHostAddress());
                throw new FetchException(FetchStatus.PRIVATE_ADDRESS_ERROR,
                        "Host " + host + " resolves to private address " + address.getHostAddress());
            }
        }
    }

    /**
     * Classifies a single address.
     *
     * @param address a resolved address
     * @return true if the address must not be fetched from without explicit permission
     */
    public static boolean isPrivate(InetAddress address) {
        if (address.isAnyLocalAddress()
                || address.isLoopbackAddress()
                || address.isLinkLocalAddress()
                || address.isSiteLocalAddress()
                || address.isMulticastAddress()) {
            return true;
        }
        if (address instanceof Inet4Address) {
            return isPrivateIpv4(address.getAddress());
        }
        if (address instanceof Inet6Address) {
            return isPrivateIpv6(address.getAddress());
        }
        return true;
    }

    private static boolean isPrivateIpv4(byte[] ip) {
        int a = ip[0] & 0xff;
        int b = ip[1] & 0xff;
        int c = ip[2] & 0xff;
        return a == 0                                   // "this" network
                || a == 10                              // RFC 1918
                || a == 127                             // loopback
                || (a == 100 && b >= 64 && b <= 127)    // carrier-grade NAT
                || (a == 169 && b == 254)               // link-local
                || (a == 172 && b >= 16 && b <= 31)     // RFC 1918
                || (a == 192 && b == 0 && c == 0)       // IETF protocol assignments
                || (a == 192 && b == 0 && c == 2)       // TEST-NET-1
                || (a == 192 && b == 168)               // RFC 1918
                || (a == 198 && (b == 18 || b == 19))   // benchmarking
                || (a == 198 && b == 51 && c == 100)    // TEST-NET-2
                || (a == 203 && b == 0 && c == 113)     // TEST-NET-3
                || a >= 224;                            // multicast, reserved, broadcast
    }

    private static boolean isPrivateIpv6(byte[] ip) {
        int first = ip[0] & 0xff;
        int second = ip[1] & 0xff;
        if ((first & 0xfe) == 0xfc) {
            return true; // unique local fc00::/7
        }
        if (first == 0xfe && (second & 0xc0) == 0xc0) {
            return true; // deprecated site-local fec0::/10
        }
        if (first == 0x20 && second == 0x01 && (ip[2] & 0xff) == 0x0d && (ip[3] & 0xff) == 0xb8) {
            return true; // documentation 2001:db8::/32
        }
        if (isIpv4Mapped(ip) || isNat64(ip)) {
            return isPrivateIpv4(new byte[] {ip[12], ip[13], ip[14], ip[15]});
        }
        if (first == 0x01 && second == 0x00 && allZero(ip, 2, 8)) {
            return true; // discard-only 100::/64
        }
        return allZero(ip, 0, 12); // IPv4-compatible ::a.b.c.d and the unspecified address
    }

    private static boolean isIpv4Mapped(byte[] ip) {
        return allZero(ip, 0, 10) && (ip[10] & 0xff) == 0xff && (ip[11] & 0xff) == 0xff;
    }

    private static boolean isNat64(byte[] ip) {
        return (ip[0] & 0xff) == 0x00 && (ip[1] & 0xff) == 0x64
                && (ip[2] & 0xff) == 0xff && (ip[3] & 0xff) == 0x9b && allZero(ip, 4, 12);
    }

    private static boolean allZero(byte[] ip, int from, int to) {
        for (int i = from; i < to; i++) {
            if (ip[i] != 0) {
                return false;
            }
        }
        return true;
    }

    /** Host name resolution seam. */
    @FunctionalInterface
    interface HostResolver {
        InetAddress[] resolve(String host) throws UnknownHostException;
    }
}

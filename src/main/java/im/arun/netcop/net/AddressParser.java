package im.arun.netcop.net;

import com.google.common.net.InetAddresses;
import com.google.common.primitives.Ints;
import im.arun.netcop.exception.NotANetworkException;
import im.arun.netcop.exception.NotAnAddressException;

import java.net.Inet4Address;
import java.net.InetAddress;

/**
 * Parses IP address and network literals found in configs. Never performs DNS lookups.
 */
public final class AddressParser {

    private AddressParser() {}

    /**
     * Parse an IPv4 or IPv6 address literal.
     *
     * @throws NotAnAddressException if the text is not an address literal
     */
    public static InetAddress parseAddress(String text) {
        try {
            return InetAddresses.forString(text);
        } catch (IllegalArgumentException e) {
            throw new NotAnAddressException(text, e);
        }
    }

    /**
     * Parse a network in {@code address/prefix} notation; an IPv4 prefix may also be written as a
     * dotted netmask or hostmask. A bare address is a host network
     * ({@code /32} or {@code /128}). Host bits must be zero.
     *
     * @throws NotANetworkException if the text is not a valid network
     */
    public static IpNetwork parseNetwork(String text) {
        int slash = text.indexOf('/');
        String addressPart = slash < 0 ? text : text.substring(0, slash);

        InetAddress address;
        try {
            address = InetAddresses.forString(addressPart);
        } catch (IllegalArgumentException e) {
            throw new NotANetworkException(text, e);
        }

        int maxPrefix = address.getAddress().length * 8;
        int prefix = maxPrefix;
        if (slash >= 0) {
            String prefixPart = text.substring(slash + 1);
            if (address instanceof Inet4Address && prefixPart.indexOf('.') >= 0) {
                prefix = prefixFromMask(text, prefixPart);
            } else {
                try {
                    prefix = Integer.parseInt(prefixPart);
                } catch (NumberFormatException e) {
                    throw new NotANetworkException(text, e);
                }
                if (prefix < 0 || prefix > maxPrefix || !prefixPart.chars().allMatch(Character::isDigit)) {
                    throw new NotANetworkException(text, "invalid prefix length " + prefixPart);
                }
            }
        }

        if (!IpNetwork.hasZeroHostBits(address.getAddress(), prefix)) {
            throw new NotANetworkException(text, "has host bits set");
        }
        return new IpNetwork(address, prefix);
    }

    /** A dotted IPv4 netmask ({@code 255.0.0.0}) or hostmask ({@code 0.255.255.255}) as a prefix length. */
    private static int prefixFromMask(String text, String maskPart) {
        InetAddress mask;
        try {
            mask = InetAddresses.forString(maskPart);
        } catch (IllegalArgumentException e) {
            throw new NotANetworkException(text, e);
        }
        if (!(mask instanceof Inet4Address)) {
            throw new NotANetworkException(text, "invalid mask " + maskPart);
        }
        int bits = Ints.fromByteArray(mask.getAddress());
        if (isContiguousPrefix(bits)) {
            return Integer.bitCount(bits);
        }
        if (isContiguousPrefix(~bits)) {
            return Integer.bitCount(~bits);
        }
        throw new NotANetworkException(text, "invalid mask " + maskPart);
    }

    private static boolean isContiguousPrefix(int bits) {
        int ones = Integer.bitCount(bits);
        return bits == (ones == 0 ? 0 : -1 << (32 - ones));
    }
}

package im.arun.netcop.net;

import com.google.common.base.Preconditions;
import com.google.common.net.InetAddresses;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.net.InetAddress;

/**
 * An IPv4 or IPv6 network: a base address with all host bits zero and a prefix length.
 */
@Getter
@EqualsAndHashCode
public final class IpNetwork {
    private final InetAddress address;
    private final int prefixLength;

    IpNetwork(InetAddress address, int prefixLength) {
        Preconditions.checkArgument(prefixLength >= 0 && prefixLength <= address.getAddress().length * 8,
            "prefix length %s out of range", prefixLength);
        this.address = address;
        this.prefixLength = prefixLength;
    }

    public boolean contains(InetAddress candidate) {
        byte[] base = address.getAddress();
        byte[] other = candidate.getAddress();
        if (base.length != other.length) {
            return false;
        }
        int fullBytes = prefixLength / 8;
        for (int i = 0; i < fullBytes; i++) {
            if (base[i] != other[i]) {
                return false;
            }
        }
        int remainingBits = prefixLength % 8;
        if (remainingBits == 0) {
            return true;
        }
        int mask = (0xFF << (8 - remainingBits)) & 0xFF;
        return (base[fullBytes] & mask) == (other[fullBytes] & mask);
    }

    static boolean hasZeroHostBits(byte[] bytes, int prefixLength) {
        for (int bit = prefixLength; bit < bytes.length * 8; bit++) {
            if ((bytes[bit / 8] & (0x80 >>> (bit % 8))) != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return InetAddresses.toAddrString(address) + "/" + prefixLength;
    }
}

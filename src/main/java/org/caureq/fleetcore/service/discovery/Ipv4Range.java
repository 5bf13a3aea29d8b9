package org.caureq.fleetcore.service.discovery;

import java.util.ArrayList;
import java.util.List;

/**
 * An IPv4 CIDR block. Host enumeration skips the network and broadcast addresses except
 * for /31 (both addresses usable) and /32 (the single address).
 */
public record Ipv4Range(int network, int prefix) {

    public static Ipv4Range parse(String cidr) {
        if (cidr == null || cidr.isBlank()) throw new IllegalArgumentException("network range is required");
        String[] parts = cidr.trim().split("/");
        if (parts.length != 2) throw new IllegalArgumentException("invalid CIDR (expected a.b.c.d/n): " + cidr);
        int prefix;
        try {
            prefix = Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid CIDR prefix: " + cidr);
        }
        if (prefix < 0 || prefix > 32) throw new IllegalArgumentException("CIDR prefix out of range: " + cidr);
        int addr = toInt(parts[0]);
        return new Ipv4Range(addr & mask(prefix), prefix);
    }

    /** Number of usable host addresses. */
    public long hostCount() {
        long size = 1L << (32 - prefix);
        return prefix >= 31 ? size : size - 2;
    }

    public List<String> hosts(int maxHosts) {
        long count = hostCount();
        if (count > maxHosts) {
            throw new IllegalArgumentException("range " + this + " has " + count + " hosts, limit is " + maxHosts);
        }
        long first = Integer.toUnsignedLong(network) + (prefix >= 31 ? 0 : 1);
        List<String> out = new ArrayList<>((int) count);
        for (long i = 0; i < count; i++) out.add(toDotted((int) (first + i)));
        return out;
    }

    public boolean contains(String ip) {
        return (toInt(ip) & mask(prefix)) == network;
    }

    @Override
    public String toString() { return toDotted(network) + "/" + prefix; }

    public static boolean isAddress(String ip) {
        try {
            toInt(ip);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    static int toInt(String dotted) {
        if (dotted == null) throw new IllegalArgumentException("IPv4 address is required");
        String[] o = dotted.trim().split("\\.", -1);
        if (o.length != 4) throw new IllegalArgumentException("invalid IPv4 address: " + dotted);
        int v = 0;
        for (String s : o) {
            if (s.isEmpty() || s.length() > 3 || !s.chars().allMatch(Character::isDigit)) {
                throw new IllegalArgumentException("invalid IPv4 address: " + dotted);
            }
            int b = Integer.parseInt(s);
            if (b > 255) throw new IllegalArgumentException("invalid IPv4 address: " + dotted);
            v = (v << 8) | b;
        }
        return v;
    }

    static String toDotted(int v) {
        return ((v >>> 24) & 0xff) + "." + ((v >>> 16) & 0xff) + "." + ((v >>> 8) & 0xff) + "." + (v & 0xff);
    }

    private static int mask(int prefix) {
        return prefix == 0 ? 0 : 0xffffffff << (32 - prefix);
    }
}

package cz.vut.fit.txtdirect.resolver;

import com.google.common.base.Splitter;
import com.google.common.net.InetAddresses;
import cz.vut.fit.txtdirect.models.RedirectRecord;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;

/**
 * Helpers for classifying request hosts and deriving the DNS zones that are queried for them.
 */
public final class Hosts {
    private Hosts() {
    }

    /**
     * Checks whether a host is a literal IP address. Besides proper IPv4/IPv6 literals (with or without a port
     * or brackets), anything with more than two colons or with a numeric last label is treated as an address,
     * since no registered domain name has a numeric top-level label.
     */
    public static boolean isIP(@NotNull String host) {
        var candidate = host;
        if (candidate.startsWith("[")) {
            final var end = candidate.indexOf(']');
            candidate = end > 0 ? candidate.substring(1, end) : candidate.substring(1);
        }

        if (InetAddresses.isInetAddress(candidate))
            return true;

        if (Splitter.on(':').splitToList(candidate).size() > 2)
            return true;

        var withoutPort = candidate;
        final var colon = candidate.lastIndexOf(':');
        if (colon >= 0 && isNumeric(candidate.substring(colon + 1)))
            withoutPort = candidate.substring(0, colon);

        final var labels = Splitter.on('.').splitToList(withoutPort);
        return isNumeric(labels.get(labels.size() - 1));
    }

    private static boolean isNumeric(String value) {
        if (value.isEmpty())
            return false;

        for (var i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i)))
                return false;
        }
        return true;
    }

    /**
     * Removes a {@code :port} suffix.
     */
    @NotNull
    public static String stripPort(@NotNull String host) {
        final var colon = host.indexOf(':');
        return colon < 0 ? host : host.substring(0, colon);
    }

    /**
     * Builds the fully qualified name of the redirect zone for a host: the port is removed, the
     * {@code _redirect} label is prepended unless already present and a trailing dot is added.
     */
    @NotNull
    public static String absoluteZone(@NotNull String zone) {
        var result = stripPort(zone);

        if (!result.startsWith(RedirectRecord.BASE_ZONE))
            result = RedirectRecord.BASE_ZONE + "." + result;

        return result.endsWith(".") ? result : result + ".";
    }

    /**
     * Replaces the leftmost label of a host with {@code _}.
     */
    @NotNull
    public static String wildcard(@NotNull String host) {
        final var labels = new ArrayList<>(Splitter.on('.').splitToList(host));
        labels.set(0, "_");
        return String.join(".", labels);
    }

    /**
     * Removes the leftmost label of a zone name; returns an empty string for single-label names.
     */
    @NotNull
    public static String stripFirstLabel(@NotNull String zone) {
        final var dot = zone.indexOf('.');
        return dot < 0 ? "" : zone.substring(dot + 1);
    }
}

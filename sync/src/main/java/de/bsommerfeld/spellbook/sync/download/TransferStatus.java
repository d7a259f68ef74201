package de.bsommerfeld.spellbook.sync.download;

import java.util.Locale;

/**
 * Status line text for running transfers, e.g.
 * {@code "Downloading cards... 12.0 MB / 140.5 MB (8%)"}.
 */
public final class TransferStatus {

    private static final String UNITS = "KMGT";

    private TransferStatus() {
    }

    /**
     * One line describing a transfer in flight. The size part and the
     * percentage are left out when the server sent no length.
     */
    public static String line(String label, long transferred, long total) {
        StringBuilder line = new StringBuilder(label).append("... ").append(size(transferred));
        if (total > 0) {
            long percent = Math.min(100, transferred * 100 / total);
            line.append(" / ").append(size(total)).append(" (").append(percent).append("%)");
        }
        return line.toString();
    }

    /**
     * Binary-prefixed size with one decimal place; plain bytes below 1 KiB.
     * Unknown (negative) sizes render as {@code "unknown size"}.
     */
    public static String size(long bytes) {
        if (bytes < 0) {
            return "unknown size";
        }
        if (bytes < 1024) {
            return bytes + " B";
        }
        // floor(log1024(bytes)), capped at TiB
        int exponent = Math.min((63 - Long.numberOfLeadingZeros(bytes)) / 10, UNITS.length());
        double scaled = bytes / (double) (1L << (10 * exponent));
        return String.format(Locale.ROOT, "%.1f %sB", scaled, UNITS.charAt(exponent - 1));
    }
}

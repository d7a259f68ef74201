package de.bsommerfeld.spellbook.db.pricing;

import java.util.Locale;

/**
 * A card as recorded in the user's collection. Set code and collector
 * number are optional; without both, the entry is priced by name.
 */
record CollectionEntry(String cardName, String setCode, String collectorNumber) {

    boolean hasPrinting() {
        return setCode != null && !setCode.isBlank() && collectorNumber != null && !collectorNumber.isBlank();
    }

    /** {@code name|SET|number} for printings, the bare name otherwise. */
    String cacheKey() {
        return hasPrinting()
                ? cardName + "|" + setCode.toUpperCase(Locale.ROOT) + "|" + collectorNumber
                : cardName;
    }

    /** Lookup key matching rows regardless of set-code case and leading zeros. */
    String printingKey() {
        return printingKey(setCode, collectorNumber);
    }

    static String printingKey(String setCode, String collectorNumber) {
        return setCode.toUpperCase(Locale.ROOT) + "|" + stripLeadingZeros(collectorNumber);
    }

    static String stripLeadingZeros(String number) {
        int i = 0;
        while (i < number.length() && number.charAt(i) == '0') {
            i++;
        }
        return i == number.length() ? "0" : number.substring(i);
    }
}

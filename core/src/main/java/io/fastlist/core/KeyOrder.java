// file: core/src/main/java/io/fastlist/core/KeyOrder.java
package io.fastlist.core;

import java.util.Comparator;

/**
 * Total order over object keys as the storage provider lists them.
 * <p>
 * S3 returns keys in UTF-8 binary order. That is the same as Unicode code point
 * order, but not the same as {@link String#compareTo(String)}, which compares
 * UTF-16 code units and therefore puts supplementary characters (surrogate
 * pairs, 0xD800..0xDFFF) before BMP characters in 0xE000..0xFFFF.
 */
public final class KeyOrder {

    public static final Comparator<String> COMPARATOR = KeyOrder::compare;

    private KeyOrder() {
        // utility
    }

    public static int compare(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }
}

package io.intellixity.pagesync.source;

import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Page-store ids arrive dashed or undashed; internally they are 32-char lowercase hex and
 * they are stored as {@link UUID}.
 */
public final class Ids {
  private static final Pattern HEX32 = Pattern.compile("[0-9a-f]{32}");

  private Ids() {}

  public static String normalize(String raw) {
    if (raw == null) return null;
    String s = raw.trim().replace("-", "").toLowerCase(Locale.ROOT);
    if (!HEX32.matcher(s).matches()) throw new IllegalArgumentException("Not a page-store id: '" + raw + "'");
    return s;
  }

  public static boolean isId(String raw) {
    if (raw == null) return false;
    return HEX32.matcher(raw.trim().replace("-", "").toLowerCase(Locale.ROOT)).matches();
  }

  public static UUID toUuid(String raw) {
    String s = normalize(raw);
    return UUID.fromString(s.substring(0, 8) + "-" + s.substring(8, 12) + "-" + s.substring(12, 16)
        + "-" + s.substring(16, 20) + "-" + s.substring(20));
  }

  public static String of(UUID uuid) {
    return uuid == null ? null : uuid.toString().replace("-", "");
  }

  /** Accepts a {@link UUID} or any string form; anything else yields {@code null}. */
  public static String fromStored(Object v) {
    if (v == null) return null;
    if (v instanceof UUID u) return of(u);
    String s = String.valueOf(v);
    return isId(s) ? normalize(s) : null;
  }
}

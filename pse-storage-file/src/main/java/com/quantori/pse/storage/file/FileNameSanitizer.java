package com.quantori.pse.storage.file;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import lombok.experimental.UtilityClass;

/**
 * Turns a record name into a file name that is valid on every common file system.
 *
 * <p>Unsafe characters are replaced by {@code %XX} escapes of their UTF-8 bytes. {@code %} is
 * escaped as well, so the mapping can be reversed and two different names never share a file.
 *
 * <p>Escaping can triple the length of a name. Results longer than {@link #MAX_LENGTH} characters
 * are cut and end with {@code ~} and a SHA-256 prefix of the original name, which keeps the file
 * name under the 255 byte limit once a file suffix is appended.
 */
@UtilityClass
public class FileNameSanitizer {
  private static final String RESERVED_CHARACTERS = "<>:\"/\\|?*%";
  private static final Set<String> RESERVED_NAMES = Set.of(
      "CON", "PRN", "AUX", "NUL",
      "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7", "COM8", "COM9",
      "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9");
  private static final char[] HEX = "0123456789ABCDEF".toCharArray();
  private static final int DIGEST_LENGTH = 16;

  public static final int MAX_LENGTH = 200;

  public static String sanitize(String name) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Name must not be empty");
    }
    StringBuilder result = new StringBuilder(name.length());
    name.codePoints().forEach(codePoint -> {
      if (isSafe(codePoint)) {
        result.appendCodePoint(codePoint);
      } else {
        escape(result, codePoint);
      }
    });
    escapeTrailingDotsAndSpaces(result);
    escapeReservedName(result);
    return shorten(result.toString(), name);
  }

  private static boolean isSafe(int codePoint) {
    return codePoint >= 0x20 && codePoint < 0x7f && RESERVED_CHARACTERS.indexOf(codePoint) < 0;
  }

  private static void escape(StringBuilder target, int codePoint) {
    for (byte b : new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8)) {
      target.append('%').append(HEX[(b >> 4) & 0x0f]).append(HEX[b & 0x0f]);
    }
  }

  // Windows drops trailing dots and spaces
  private static void escapeTrailingDotsAndSpaces(StringBuilder name) {
    int end = name.length();
    while (end > 0 && (name.charAt(end - 1) == '.' || name.charAt(end - 1) == ' ')) {
      end--;
    }
    if (end == name.length()) {
      return;
    }
    String tail = name.substring(end);
    name.setLength(end);
    tail.chars().forEach(c -> escape(name, c));
  }

  private static void escapeReservedName(StringBuilder name) {
    int dot = name.indexOf(".");
    String base = dot < 0 ? name.toString() : name.substring(0, dot);
    if (RESERVED_NAMES.contains(base.toUpperCase(Locale.ROOT))) {
      char first = name.charAt(0);
      name.deleteCharAt(0);
      StringBuilder escaped = new StringBuilder();
      escape(escaped, first);
      name.insert(0, escaped);
    }
  }

  private static String shorten(String sanitized, String name) {
    if (sanitized.length() <= MAX_LENGTH) {
      return sanitized;
    }
    int end = MAX_LENGTH - DIGEST_LENGTH - 1;
    // never split a %XX escape
    int percent = sanitized.lastIndexOf('%', end - 1);
    if (percent > end - 3) {
      end = percent;
    }
    String digest = Hashing.sha256().hashString(name, StandardCharsets.UTF_8).toString();
    return sanitized.substring(0, end) + "~" + digest.substring(0, DIGEST_LENGTH);
  }
}

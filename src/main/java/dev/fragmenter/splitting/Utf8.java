package dev.fragmenter.splitting;

import java.nio.charset.StandardCharsets;

/** Byte accounting shared by the splitters. Budgets are always expressed in UTF-8 bytes. */
final class Utf8 {

  private Utf8() {
    // utility class
  }

  static int byteLength(String text) {
    return text.getBytes(StandardCharsets.UTF_8).length;
  }
}

package com.zexats.admission.store.redis;

final class RedisKeyPatterns {
  private RedisKeyPatterns() {}

  /** Builds a {@code SCAN MATCH} pattern matching every key that starts with {@code prefix}. */
  static String prefixPattern(String prefix) {
    StringBuilder pattern = new StringBuilder(prefix.length() + 1);
    for (char c : prefix.toCharArray()) {
      if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
        pattern.append('\\');
      }
      pattern.append(c);
    }
    return pattern.append('*').toString();
  }
}

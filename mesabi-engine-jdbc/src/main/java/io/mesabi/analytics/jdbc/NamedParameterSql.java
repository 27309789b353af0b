package io.mesabi.analytics.jdbc;

/**
 * Rewrites SQL containing named parameters (e.g. {@code :b1}) into JDBC SQL with {@code ?} placeholders.
 * <p>
 * Rules:
 * <ul>
 *   <li>params are {@code ':'} followed by {@code [A-Za-z_][A-Za-z0-9_]*}</li>
 *   <li>{@code '::'} is a cast, not a param</li>
 *   <li>params inside single or double quotes are ignored</li>
 * </ul>
 */
public final class NamedParameterSql {
  private NamedParameterSql() {}

  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder out = new StringBuilder(sql.length() + 16);
    char quote = 0;

    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (ch == '\'' || ch == '"') {
        if (quote == 0) {
          quote = ch;
        } else if (quote == ch) {
          // doubled quote is an escape
          if (i + 1 < sql.length() && sql.charAt(i + 1) == ch) {
            out.append(ch).append(ch);
            i++;
            continue;
          }
          quote = 0;
        }
        out.append(ch);
        continue;
      }

      if (quote == 0 && ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          out.append("::");
          i++;
          continue;
        }

        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          out.append('?');
          i = end - 1;
          continue;
        }
      }

      out.append(ch);
    }

    return out.toString();
  }

  /** Number of named params outside quotes. */
  public static int countParams(String sql) {
    String jdbc = toJdbcSql(sql);
    int n = 0;
    char quote = 0;
    for (int i = 0; i < jdbc.length(); i++) {
      char ch = jdbc.charAt(i);
      if (ch == '\'' || ch == '"') {
        if (quote == 0) quote = ch;
        else if (quote == ch) quote = 0;
      } else if (quote == 0 && ch == '?') {
        n++;
      }
    }
    return n;
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}

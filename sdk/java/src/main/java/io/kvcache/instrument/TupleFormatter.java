package io.kvcache.instrument;

import io.kvcache.value.StoredValue;

final class TupleFormatter implements ArgumentFormatter {

    static final TupleFormatter INSTANCE = new TupleFormatter();

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private TupleFormatter() {
    }

    @Override
    public String format(Object[] arguments) {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < arguments.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            appendLiteral(sb, arguments[i]);
        }
        if (arguments.length == 1) {
            sb.append(',');
        }
        return sb.append(')').toString();
    }

    private static void appendLiteral(StringBuilder sb, Object value) {
        if (value instanceof StoredValue) {
            value = ((StoredValue) value).getValue();
        }
        if (value == null) {
            sb.append("None");
        } else if (value instanceof String) {
            appendText(sb, (String) value);
        } else if (value instanceof byte[]) {
            appendBytes(sb, (byte[]) value);
        } else if (value instanceof Boolean) {
            sb.append((Boolean) value ? "True" : "False");
        } else if (value instanceof Double || value instanceof Float) {
            sb.append(StoredValue.formatFloating(((Number) value).doubleValue()));
        } else {
            sb.append(value);
        }
    }

    private static void appendText(StringBuilder sb, String s) {
        char quote = s.indexOf('\'') >= 0 && s.indexOf('"') < 0 ? '"' : '\'';
        sb.append(quote);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == quote || c == '\\') {
                sb.append('\\').append(c);
            } else if (!appendControl(sb, c)) {
                sb.append(c);
            }
        }
        sb.append(quote);
    }

    private static void appendBytes(StringBuilder sb, byte[] bytes) {
        boolean hasSingle = false;
        boolean hasDouble = false;
        for (byte b : bytes) {
            hasSingle |= b == '\'';
            hasDouble |= b == '"';
        }
        char quote = hasSingle && !hasDouble ? '"' : '\'';
        sb.append('b').append(quote);
        for (byte b : bytes) {
            int c = b & 0xff;
            if (c == quote || c == '\\') {
                sb.append('\\').append((char) c);
            } else if (c >= 0x20 && c < 0x7f) {
                sb.append((char) c);
            } else if (!appendControl(sb, (char) c)) {
                appendHex(sb, c);
            }
        }
        sb.append(quote);
    }

    // \t, \n and \r get their short escapes, any other control character is hex-escaped
    private static boolean appendControl(StringBuilder sb, char c) {
        switch (c) {
            case '\t' -> sb.append("\\t");
            case '\n' -> sb.append("\\n");
            case '\r' -> sb.append("\\r");
            default -> {
                if (c < 0x20 || c == 0x7f) {
                    appendHex(sb, c);
                    return true;
                }
                return false;
            }
        }
        return true;
    }

    private static void appendHex(StringBuilder sb, int c) {
        sb.append("\\x").append(HEX[(c >> 4) & 0xf]).append(HEX[c & 0xf]);
    }
}

package com.baskettecase.sqlmon.db;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parser for the properties portion of a SQL Server connection string,
 * i.e. {@code key1=value1;key2=value2;...}.
 *
 * The input must not contain the subprotocol, server name, instance name or port.
 * Values may be wrapped in braces to carry reserved characters; inside braces
 * {@code }}} stands for a literal closing brace. Only {@code = ; { }} are reserved,
 * everything else is left to the driver and the server to judge.
 *
 * @see <a href="https://learn.microsoft.com/en-us/sql/connect/jdbc/building-the-connection-url">Building the connection URL</a>
 */
public final class ConnectionStringParser {

    static final String SECRET_MASK = "******";

    private enum State {
        OUTSIDE,
        ESCAPING
    }

    private ConnectionStringParser() {
    }

    /**
     * Parse connection string properties into an ordered map.
     *
     * @param connectionString properties-only connection string
     * @return option name to value, in the order the options appear
     * @throws ConnectionConfigurationException on any syntax error
     */
    public static Map<String, String> parse(String connectionString) {
        String cs = connectionString.strip();
        Map<String, String> params = new LinkedHashMap<>();

        State state = State.OUTSIDE;
        String key = "";
        StringBuilder parsed = new StringBuilder();
        boolean keyDone = false;

        int i = 0;
        while (i < cs.length()) {
            char c = cs.charAt(i);

            if (state == State.ESCAPING) {
                if (c == '}' && i + 1 < cs.length() && cs.charAt(i + 1) == '}') {
                    parsed.append('}');
                    i += 2;
                    continue;
                }
                if (c == '}') {
                    state = State.OUTSIDE;
                } else {
                    parsed.append(c);
                }
                i++;
                continue;
            }

            switch (c) {
                case '{':
                    state = State.ESCAPING;
                    break;
                case '=':
                    if (keyDone) {
                        throw invalid(params, key, parsed, "unexpected '=' while parsing value at index=" + i, cs);
                    }
                    key = parsed.toString();
                    if (key.isEmpty()) {
                        throw invalid(params, key, parsed, "empty key at index=" + i, cs);
                    }
                    parsed.setLength(0);
                    keyDone = true;
                    break;
                case ';':
                    if (!keyDone) {
                        throw invalid(params, key, parsed, "missing '=' before ';' at index=" + i, cs);
                    }
                    if (parsed.length() == 0) {
                        throw invalid(params, key, parsed, "empty value at index=" + i, cs);
                    }
                    params.put(key, parsed.toString());
                    key = "";
                    parsed.setLength(0);
                    keyDone = false;
                    break;
                case '}':
                    throw invalid(params, key, parsed, "invalid character '}' at index=" + i, cs);
                case ' ':
                    // whitespace between two options, e.g. "A=B;  C=D"
                    if (keyDone || parsed.length() > 0) {
                        parsed.append(c);
                    }
                    break;
                default:
                    parsed.append(c);
            }
            i++;
        }

        // the trailing ';' is optional
        if (state == State.ESCAPING) {
            throw invalid(params, key, parsed, "did not find expected matching closing brace '}'", cs);
        }
        if (keyDone) {
            if (parsed.length() == 0) {
                throw invalid(params, key, parsed, "empty value at the end of the connection string", cs);
            }
            params.put(key, parsed.toString());
        } else if (parsed.length() > 0) {
            throw invalid(params, key, parsed, "missing '=' at the end of the connection string", cs);
        }
        return params;
    }

    private static ConnectionConfigurationException invalid(
            Map<String, String> params, String key, CharSequence pending, String reason, String cs) {
        String shown = cs;
        for (Map.Entry<String, String> param : params.entrySet()) {
            shown = mask(shown, param.getKey(), param.getValue());
        }
        shown = mask(shown, key, pending.toString());
        return new ConnectionConfigurationException("Invalid connection string: " + reason + ": " + shown);
    }

    private static String mask(String cs, String key, String value) {
        if (value.isEmpty() || !isSecret(key)) {
            return cs;
        }
        return cs.replace(value, SECRET_MASK);
    }

    private static boolean isSecret(String key) {
        String trimmed = key.trim();
        return trimmed.equalsIgnoreCase("PWD") || trimmed.equalsIgnoreCase("Password");
    }
}

/* This code is part of Scytale. It is distributed under the GNU General
 * Public License, version 2 (or at your option any later version). See
 * http://www.gnu.org/ for further details of the GPL. */
package scytale.crypt.settings;

import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scytale.crypt.CipherException;
import scytale.crypt.CipherSpec;
import scytale.crypt.CipherType;
import scytale.crypt.key.AffineKey;
import scytale.crypt.key.CipherKey;
import scytale.crypt.key.EmptyKey;
import scytale.crypt.key.KeywordKey;
import scytale.crypt.key.MatrixKey;
import scytale.crypt.key.RailKey;
import scytale.crypt.key.RouteKey;
import scytale.crypt.key.ShiftKey;
import scytale.crypt.transposition.RoutePattern;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * A flat, textual description of a cipher and its key, read from and written to the line format
 * below.
 * <pre>
 * # Optional header comments
 * Cipher=HILL
 * Matrix=2,1;3,4
 * End
 * </pre>
 * <p>
 * Lines starting with {@code #} before the first field are headers; later ones are skipped as
 * comments. Every other non-empty line is a {@code key=value} pair, except a line without
 * {@code =}, which is the end marker and stops parsing. Fields that no cipher uses are logged and dropped.
 * </p>
 * <p>
 * Which fields are read depends on {@link #CIPHER}: {@link #SHIFT} for Caesar and August
 * (August defaults to {@value ShiftKey#DEFAULT_AUGUST_SHIFT}), {@link #A} and {@link #B} for
 * Affine, {@link #KEYWORD} for Vigenère, Beaufort, Autokey and Myszkowski, {@link #MATRIX} for
 * Hill, {@link #RAILS} for Rail Fence, and {@link #ROWS}, {@link #COLS} and {@link #PATTERN}
 * (default {@code spiral_in}) for Route. Atbash takes no field.
 * </p>
 */
public final class CipherSettings {
    private static final Logger logger = LoggerFactory.getLogger(CipherSettings.class);

    public static final char KEYVALUE_SEPARATOR_CHAR = '=';

    /**
     * Separates the rows of a {@link #MATRIX} value.
     */
    public static final char MULTI_VALUE_CHAR = ';';

    /**
     * Separates the entries within a row of a {@link #MATRIX} value.
     */
    public static final char ENTRY_SEPARATOR_CHAR = ',';

    public static final String DEFAULT_END_MARKER = "End";

    public static final String CIPHER = "Cipher";
    public static final String SHIFT = "Shift";
    public static final String A = "A";
    public static final String B = "B";
    public static final String KEYWORD = "Keyword";
    public static final String MATRIX = "Matrix";
    public static final String RAILS = "Rails";
    public static final String ROWS = "Rows";
    public static final String COLS = "Cols";
    public static final String PATTERN = "Pattern";

    private static final Set<String> KNOWN_FIELDS =
        Set.of(CIPHER, SHIFT, A, B, KEYWORD, MATRIX, RAILS, ROWS, COLS, PATTERN);

    /**
     * Creates empty settings.
     */
    public CipherSettings() {
    }

    /**
     * Parses settings from their textual form.
     *
     * @param content the text, one header, field or end marker per line
     *
     * @return the parsed settings
     *
     * @throws SettingsParseException if the text is empty or a field appears twice
     */
    public static CipherSettings parse(String content) throws SettingsParseException {
        if (StringUtils.isBlank(content)) {
            throw new SettingsParseException("Empty settings");
        }
        CipherSettings settings = new CipherSettings();
        boolean headerSection = true;
        for (String line : content.split("\\R")) {
            if (line.isEmpty()) {
                continue;
            }
            if (line.charAt(0) == '#') {
                // after the first field a # line is a comment
                if (headerSection) {
                    settings.headers.add(line.substring(1).trim());
                }
                continue;
            }
            headerSection = false;
            int separatorIndex = line.indexOf(KEYVALUE_SEPARATOR_CHAR);
            if (separatorIndex < 0) {
                settings.endMarker = line.trim();
                break;
            }
            String key = line.substring(0, separatorIndex).trim();
            String value = line.substring(separatorIndex + 1).trim();
            if (!KNOWN_FIELDS.contains(key)) {
                logger.warn("Ignoring unknown settings field {}={}", key, value);
                continue;
            }
            if (settings.fields.containsKey(key)) {
                throw new SettingsParseException("Duplicate field " + key);
            }
            settings.fields.put(key, value);
        }
        if (settings.endMarker == null) {
            logger.debug("No end marker found in settings");
        }
        return settings;
    }

    /**
     * Describes a cipher and key as settings.
     *
     * @param spec the cipher and key
     *
     * @return settings whose {@link #toSpec()} is equal to {@code spec}
     */
    public static CipherSettings fromSpec(CipherSpec spec) {
        CipherSettings settings = new CipherSettings();
        settings.put(CIPHER, spec.type().name());
        CipherKey key = spec.key();
        if (key instanceof ShiftKey shiftKey) {
            settings.put(SHIFT, shiftKey.shift());
        } else if (key instanceof AffineKey affineKey) {
            settings.put(A, affineKey.a());
            settings.put(B, affineKey.b());
        } else if (key instanceof KeywordKey keywordKey) {
            settings.put(KEYWORD, keywordKey.keyword());
        } else if (key instanceof MatrixKey matrixKey) {
            settings.put(MATRIX, formatMatrix(matrixKey.toArray()));
        } else if (key instanceof RailKey railKey) {
            settings.put(RAILS, railKey.rails());
        } else if (key instanceof RouteKey routeKey) {
            settings.put(ROWS, routeKey.rows());
            settings.put(COLS, routeKey.cols());
            settings.put(PATTERN, routeKey.pattern().patternName);
        }
        settings.endMarker = DEFAULT_END_MARKER;
        return settings;
    }

    /**
     * Returns the value of a field.
     *
     * @param key the field name
     *
     * @return the value, or {@code null} if the field is not set
     */
    public @Nullable String get(String key) {
        return fields.get(key);
    }

    /**
     * Sets a field, replacing any previous value.
     *
     * @param key   the field name
     * @param value the value, which must fit on one line
     */
    public void put(String key, String value) {
        if (value.indexOf('\n') != -1 || value.indexOf('\r') != -1) {
            throw new IllegalArgumentException("Settings values cannot contain newlines");
        }
        if (key.isEmpty() || key.indexOf(KEYVALUE_SEPARATOR_CHAR) != -1) {
            throw new IllegalArgumentException("Invalid settings key: " + key);
        }
        fields.put(key, value);
    }

    public void put(String key, int value) {
        put(key, Integer.toString(value));
    }

    /**
     * Returns an integer field.
     *
     * @param key the field name
     *
     * @return the value
     *
     * @throws SettingsParseException if the field is missing or not an integer
     */
    public int getInt(String key) throws SettingsParseException {
        String s = get(key);
        if (s == null) {
            throw new SettingsParseException("No integer key " + key);
        }
        return parseInt(key, s);
    }

    /**
     * Returns an integer field, or a default if it is missing. A value that is present but not
     * an integer is still an error.
     *
     * @param key the field name
     * @param def the value to return if the field is missing
     *
     * @return the value
     *
     * @throws SettingsParseException if the field is not an integer
     */
    public int getInt(String key, int def) throws SettingsParseException {
        String s = get(key);
        return s == null ? def : parseInt(key, s);
    }

    /**
     * Returns a string field.
     *
     * @param key the field name
     *
     * @return the value
     *
     * @throws SettingsParseException if the field is missing
     */
    public String getString(String key) throws SettingsParseException {
        String s = get(key);
        if (s == null) {
            throw new SettingsParseException("No key " + key);
        }
        return s;
    }

    /**
     * Builds the cipher and key these settings describe.
     *
     * @return the cipher specification
     *
     * @throws SettingsParseException if the cipher is unknown, a field it needs is missing or
     *                                malformed, or the fields do not make a key of the right
     *                                shape
     */
    public CipherSpec toSpec() throws SettingsParseException {
        CipherType type;
        try {
            type = CipherType.fromName(getString(CIPHER));
        } catch (CipherException e) {
            throw new SettingsParseException(e);
        }
        CipherKey key = switch (type) {
            case CAESAR -> new ShiftKey(getInt(SHIFT));
            case AUGUST -> new ShiftKey(getInt(SHIFT, ShiftKey.DEFAULT_AUGUST_SHIFT));
            case AFFINE -> new AffineKey(getInt(A), getInt(B));
            case ATBASH -> EmptyKey.INSTANCE;
            case VIGENERE, BEAUFORT, AUTOKEY, MYSZKOWSKI -> new KeywordKey(getString(KEYWORD));
            case HILL -> matrixKey(getString(MATRIX));
            case RAIL_FENCE -> new RailKey(getInt(RAILS));
            case ROUTE -> new RouteKey(getInt(ROWS), getInt(COLS), routePattern());
        };
        return new CipherSpec(type, key);
    }

    /**
     * Returns the header lines, without their leading {@code #}.
     *
     * @return an unmodifiable view of the headers
     */
    public List<String> getHeaders() {
        return Collections.unmodifiableList(headers);
    }

    public void addHeader(String header) {
        if (header.indexOf('\n') != -1) {
            throw new IllegalArgumentException("Headers cannot contain newlines");
        }
        headers.add(header);
    }

    public @Nullable String getEndMarker() {
        return endMarker;
    }

    /**
     * Writes these settings out with the fields in alphabetical order, in the form
     * {@link #parse(String)} reads.
     *
     * @return the text, ending with the end marker if one is set
     */
    public String toOrderedString() {
        StringBuilder sb = new StringBuilder();
        for (String header : headers) {
            sb.append('#').append(' ').append(header).append('\n');
        }
        for (Map.Entry<String, String> field : fields.entrySet()) {
            sb.append(field.getKey()).append(KEYVALUE_SEPARATOR_CHAR).append(field.getValue())
              .append('\n');
        }
        if (endMarker != null) {
            sb.append(endMarker).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toOrderedString();
    }

    private RoutePattern routePattern() throws SettingsParseException {
        String name = get(PATTERN);
        if (name == null) {
            return RoutePattern.SPIRAL_IN;
        }
        try {
            return RoutePattern.fromName(name);
        } catch (CipherException e) {
            throw new SettingsParseException(e);
        }
    }

    private static MatrixKey matrixKey(String value) throws SettingsParseException {
        String[] rowValues = StringUtils.split(value, MULTI_VALUE_CHAR);
        List<List<Integer>> rows = new ArrayList<>(rowValues.length);
        for (String rowValue : rowValues) {
            List<Integer> row = new ArrayList<>();
            for (String entry : StringUtils.split(rowValue, ENTRY_SEPARATOR_CHAR)) {
                row.add(parseInt(MATRIX, entry.trim()));
            }
            rows.add(row);
        }
        try {
            return new MatrixKey(rows);
        } catch (CipherException e) {
            throw new SettingsParseException(e);
        }
    }

    private static String formatMatrix(int[][] matrix) {
        StringJoiner rows = new StringJoiner(String.valueOf(MULTI_VALUE_CHAR));
        for (int[] row : matrix) {
            StringJoiner entries = new StringJoiner(String.valueOf(ENTRY_SEPARATOR_CHAR));
            for (int entry : row) {
                entries.add(Integer.toString(entry));
            }
            rows.add(entries.toString());
        }
        return rows.toString();
    }

    private static int parseInt(String key, String value) throws SettingsParseException {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new SettingsParseException("Cannot parse integer " + value + " for " + key, e);
        }
    }

    private final Map<String, String> fields = new TreeMap<>();
    private final List<String> headers = new ArrayList<>();
    private @Nullable String endMarker;
}

package io.caldera.core.frame;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/// Reads the primary header of a FITS file.
///
/// The header is a sequence of 2880-byte blocks holding 80-column cards and
/// ends at the `END` card. Commentary cards (`COMMENT`, `HISTORY`, blank) are
/// skipped. Value parsing:
/// - `'text'` becomes a `String` with trailing blanks removed and `''` unescaped
/// - `T`/`F` become `Boolean`
/// - integers become `Long`, other numbers `Double` (a `D` exponent is accepted)
/// - anything else is kept as the trimmed `String`
public class FitsHeaderReader implements HeaderReader {

    static final int BLOCK = 2880;
    static final int CARD = 80;

    @Override
    public Map<String, Object> read(Path file) throws IOException {
        Map<String, Object> header = new LinkedHashMap<>();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] block = new byte[BLOCK];
            boolean first = true;
            while (true) {
                int n = in.readNBytes(block, 0, BLOCK);
                if (n < BLOCK) {
                    throw new IOException("Truncated FITS header in " + file);
                }
                for (int offset = 0; offset < BLOCK; offset += CARD) {
                    String card = new String(block, offset, CARD, StandardCharsets.US_ASCII);
                    String key = card.substring(0, 8).trim();
                    if (first) {
                        if (!"SIMPLE".equals(key)) {
                            throw new IOException("Not a FITS file: " + file);
                        }
                        first = false;
                    }
                    if ("END".equals(key)) {
                        return header;
                    }
                    if (key.isEmpty() || !card.startsWith("= ", 8)) {
                        continue;
                    }
                    header.put(key, parseValue(card.substring(10)));
                }
            }
        }
    }

    static Object parseValue(String field) {
        String text = field.trim();
        if (text.startsWith("'")) {
            StringBuilder value = new StringBuilder();
            for (int i = 1; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '\'') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                        value.append('\'');
                        i++;
                        continue;
                    }
                    break;
                }
                value.append(c);
            }
            return value.toString().stripTrailing();
        }
        int slash = text.indexOf('/');
        if (slash >= 0) {
            text = text.substring(0, slash).trim();
        }
        if ("T".equals(text)) {
            return Boolean.TRUE;
        }
        if ("F".equals(text)) {
            return Boolean.FALSE;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException notInteger) {
            try {
                return Double.parseDouble(text.replace('D', 'E'));
            } catch (NumberFormatException notNumber) {
                return text;
            }
        }
    }
}

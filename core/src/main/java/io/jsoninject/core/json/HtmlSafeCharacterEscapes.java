package io.jsoninject.core.json;

import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;

/**
 * Jackson escapes that keep generated JSON inert inside an HTML {@code <script>} element: {@code <},
 * {@code >} and {@code &} in string values are written as unicode escapes, so a data value such as
 * {@code "</script>"} cannot close the element. Line and paragraph separators are escaped for
 * engines that reject them in string literals. The JSON value itself is unchanged.
 */
final class HtmlSafeCharacterEscapes extends CharacterEscapes {

    private static final long serialVersionUID = 1L;

    static final HtmlSafeCharacterEscapes INSTANCE = new HtmlSafeCharacterEscapes();

    private static final SerializedString LT = new SerializedString("\\u003C");
    private static final SerializedString GT = new SerializedString("\\u003E");
    private static final SerializedString AMP = new SerializedString("\\u0026");
    private static final SerializedString LINE_SEPARATOR = new SerializedString("\\u2028");
    private static final SerializedString PARAGRAPH_SEPARATOR = new SerializedString("\\u2029");

    private final int[] asciiEscapes;

    private HtmlSafeCharacterEscapes() {
        int[] escapes = CharacterEscapes.standardAsciiEscapesForJSON();
        escapes['<'] = CharacterEscapes.ESCAPE_CUSTOM;
        escapes['>'] = CharacterEscapes.ESCAPE_CUSTOM;
        escapes['&'] = CharacterEscapes.ESCAPE_CUSTOM;
        this.asciiEscapes = escapes;
    }

    @Override
    public int[] getEscapeCodesForAscii() {
        return asciiEscapes;
    }

    @Override
    public SerializableString getEscapeSequence(int ch) {
        return switch (ch) {
            case '<' -> LT;
            case '>' -> GT;
            case '&' -> AMP;
            case 0x2028 -> LINE_SEPARATOR;
            case 0x2029 -> PARAGRAPH_SEPARATOR;
            default -> null;
        };
    }
}

package com.mentionindex.parser;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 公司颜色取值解析：调色板名称转十六进制，其余格式原样保留。
 */
public final class CompanyColors {

    private static final Pattern HEX_WITH_HASH = Pattern.compile("^#[0-9a-fA-F]{6}$");
    private static final Pattern HEX_WITHOUT_HASH = Pattern.compile("^[0-9a-fA-F]{6}$");

    static final Map<String, String> PALETTE = Map.ofEntries(
            Map.entry("blue", "#0066cc"),
            Map.entry("red", "#e74c3c"),
            Map.entry("green", "#27ae60"),
            Map.entry("orange", "#f39c12"),
            Map.entry("purple", "#9b59b6"),
            Map.entry("teal", "#1abc9c"),
            Map.entry("navy", "#2c3e50"),
            Map.entry("crimson", "#c0392b"),
            Map.entry("forest", "#229954"),
            Map.entry("amber", "#f1c40f"),
            Map.entry("violet", "#8e44ad"),
            Map.entry("cyan", "#17a2b8"),
            Map.entry("slate", "#607d8b"),
            Map.entry("rose", "#e91e63"),
            Map.entry("lime", "#8bc34a"),
            Map.entry("indigo", "#3f51b5"),
            Map.entry("pink", "#e91e63"),
            Map.entry("brown", "#795548"),
            Map.entry("mint", "#b5e550"),
            Map.entry("coral", "#ff6b35"),
            Map.entry("lavender", "#b19cd9"),
            Map.entry("gold", "#ffd700"),
            Map.entry("silver", "#c0c0c0"),
            Map.entry("bronze", "#cd7f32")
    );

    private CompanyColors() {
    }

    public static String parse(String colorValue) {
        if (colorValue == null) {
            return "";
        }
        String trimmed = colorValue.trim().toLowerCase(Locale.ROOT);
        String paletteHex = PALETTE.get(trimmed);
        if (paletteHex != null) {
            return paletteHex;
        }
        if (HEX_WITH_HASH.matcher(trimmed).matches()) {
            return trimmed;
        }
        if (HEX_WITHOUT_HASH.matcher(trimmed).matches()) {
            return "#" + trimmed;
        }
        return colorValue;
    }
}

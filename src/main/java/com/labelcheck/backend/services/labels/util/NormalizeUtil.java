package com.labelcheck.backend.services.labels.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class NormalizeUtil {

    private static final Pattern NON_PRINTABLE = Pattern.compile("[^\\x20-\\x7E]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final Pattern SPACE_BETWEEN_DIGITS = Pattern.compile("(?<=\\d)\\s+(?=\\d)");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");

    private NormalizeUtil() {
    }

    /**
     * Normaliza texto de etiqueta para casamento de padrões:
     * ASCII imprimível, espaços colapsados, dígitos separados por espaço reunidos.
     * Exemplo: "UPC 0 36000 29145 2" => "UPC 036000291452"
     */
    public static String normalize(String text) {
        if (text == null || text.isEmpty()) return "";

        // 1. Qualquer byte fora de 0x20-0x7E vira espaço (quebras de linha incluídas)
        String result = NON_PRINTABLE.matcher(text).replaceAll(" ");

        // 2. Colapsa espaços
        result = WHITESPACE_RUN.matcher(result).replaceAll(" ");

        // 3. OCR/PDF inserem espaços no meio de códigos numéricos
        result = SPACE_BETWEEN_DIGITS.matcher(result).replaceAll("");

        return result.trim();
    }

    /**
     * Chave de comparação: trim, espaços colapsados, uppercase.
     * Exemplo: " black   soot " => "BLACK SOOT"
     */
    public static String normalizeKey(String value) {
        if (value == null) return "";
        return WHITESPACE_RUN.matcher(value.trim()).replaceAll(" ").toUpperCase(Locale.ROOT);
    }

    /**
     * Mantém apenas dígitos. Usado para UPCs vindos da planilha ou da extração.
     */
    public static String digitsOnly(String value) {
        if (value == null) return "";
        return NON_DIGIT.matcher(value).replaceAll("");
    }

    public static int countNonWhitespace(String value) {
        if (value == null) return 0;
        int count = 0;
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isWhitespace(value.charAt(i))) {
                count++;
            }
        }
        return count;
    }
}

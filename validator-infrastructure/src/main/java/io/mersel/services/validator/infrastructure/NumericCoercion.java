package io.mersel.services.validator.infrastructure;

import io.mersel.services.validator.application.models.NumericParam;

import java.util.regex.Pattern;

/**
 * Kural parametresini çoğul biçim seçimi için sayıya dönüştürür.
 * <p>
 * Önce 10 tabanlı tam sayı, olmazsa ondalık sayı denenir. İkisi de başarısızsa
 * parametre string olarak kalır ve sayı 0 olur. Yalnızca opsiyonel işaret,
 * ASCII rakamlar ve tek ondalık nokta kabul edilir: "1e3", "NaN", "0x1F" ve
 * boşluk içeren değerler string kalır.
 */
final class NumericCoercion {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.\\d*|\\.\\d+)");

    private NumericCoercion() {}

    static NumericParam coerce(String param) {
        if (param == null || param.isEmpty()) {
            return new NumericParam(param != null ? param : "", 0);
        }

        if (INTEGER.matcher(param).matches()) {
            try {
                long value = Long.parseLong(param);
                return new NumericParam(value, saturate(value));
            } catch (NumberFormatException e) {
                // long aralığı dışında
                return decimal(param);
            }
        }

        if (DECIMAL.matcher(param).matches()) {
            return decimal(param);
        }

        return new NumericParam(param, 0);
    }

    private static NumericParam decimal(String param) {
        double value = Double.parseDouble(param);
        // (int) cast sıfıra doğru keser ve int sınırlarında doyar
        return new NumericParam(value, (int) value);
    }

    private static int saturate(long value) {
        if (value > Integer.MAX_VALUE) return Integer.MAX_VALUE;
        if (value < Integer.MIN_VALUE) return Integer.MIN_VALUE;
        return (int) value;
    }
}

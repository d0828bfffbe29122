package io.mersel.services.validator.infrastructure.rules;

import io.mersel.services.validator.application.enums.FormatRule;
import io.mersel.services.validator.application.interfaces.RulePredicate;

import java.util.List;

/**
 * {@link FormatRule} değerlerini {@link FormatCheckers} fonksiyonlarına bağlar.
 */
public final class FormatRules {

    private FormatRules() {}

    public static RulePredicate predicateFor(FormatRule rule) {
        return switch (rule) {
            case USERNAME -> ctx -> FormatCheckers.isValidUsername(text(ctx.value()));
            case ALPHA_NUMERIC -> ctx -> FormatCheckers.isAlphaNumeric(text(ctx.value()), toChars(ctx.param()));
            case ALPHA_NUMERIC_PERSIAN -> ctx -> FormatCheckers.isAlphaNumericWithPersian(text(ctx.value()), toChars(ctx.param()));
            case IRANIAN_PHONE -> ctx -> FormatCheckers.isValidIranianPhone(text(ctx.value()));
            case IRANIAN_MOBILE -> ctx -> FormatCheckers.isValidIranianMobile(text(ctx.value()));
            case IRANIAN_POSTAL_CODE -> ctx -> FormatCheckers.isValidIranianPostalCode(text(ctx.value()));
            case IRANIAN_ID_NUMBER -> ctx -> FormatCheckers.isValidIranianIdNumber(text(ctx.value()));
            case IRANIAN_NATIONAL_CODE -> ctx -> FormatCheckers.isValidIranianNationalCode(text(ctx.value()));
            case IRANIAN_CREDIT_NUMBER -> ctx -> FormatCheckers.isValidIranianBankCard(text(ctx.value()));
            case IRANIAN_IBAN -> ctx -> FormatCheckers.isValidIranianIban(text(ctx.value()));
            case JALAALI -> ctx -> FormatCheckers.isValidJalaali(text(ctx.value()), ctx.param());
            case IP -> ctx -> FormatCheckers.isValidIp(text(ctx.value()));
            case IP_PORT -> ctx -> FormatCheckers.isValidIpPort(text(ctx.value()));
        };
    }

    /**
     * String'i tek karakterlik parçalara ayırır; Farsça harfler ve emojiler dahil
     * her code point ayrı bir eleman olur.
     */
    static List<String> toChars(String s) {
        if (s == null || s.isEmpty()) {
            return List.of();
        }
        return s.codePoints()
                .mapToObj(cp -> new String(Character.toChars(cp)))
                .toList();
    }

    private static String text(Object value) {
        return value != null ? value.toString() : null;
    }
}

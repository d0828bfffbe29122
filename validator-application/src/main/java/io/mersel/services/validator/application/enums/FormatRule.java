package io.mersel.services.validator.application.enums;

/**
 * Hazır format denetleyici kuralları.
 * <p>
 * Her kural varsayılan bir kural adı ve kök katalog için İngilizce varsayılan
 * mesaj taşır. Kural adı ve mesajlar kayıt sırasında değiştirilebilir.
 */
public enum FormatRule {

    USERNAME("username", "Only letters, numbers, and underscores are allowed"),
    ALPHA_NUMERIC("alnum", "Only english letters and numbers are allowed"),
    ALPHA_NUMERIC_PERSIAN("alnum_fa", "Only english letters, persian letters, and numbers are allowed"),
    IRANIAN_PHONE("phone", "Must be a valid 11-digit iranian phone number"),
    IRANIAN_MOBILE("mobile", "Must be a valid 11-digit iranian mobile number"),
    IRANIAN_POSTAL_CODE("postal_code", "Must be a valid 10-digit iranian postal code"),
    IRANIAN_ID_NUMBER("id_number", "Must be a valid iranian birth certificate number"),
    IRANIAN_NATIONAL_CODE("national_code", "Must be a valid 10 digit iranian national id number"),
    IRANIAN_CREDIT_NUMBER("credit_number", "Must be a valid 16 digit iranian credit card number"),
    IRANIAN_IBAN("iban", "Must be a valid 24 digit iranian IBAN number"),
    JALAALI("jalaali", "Must be a valid jalaali datetime"),
    IP("ip_addr", "Must be a valid IP address"),
    IP_PORT("ip_port", "Must be a valid IP:port address");

    private final String defaultRuleName;
    private final String defaultMessage;

    FormatRule(String defaultRuleName, String defaultMessage) {
        this.defaultRuleName = defaultRuleName;
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultRuleName() {
        return defaultRuleName;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}

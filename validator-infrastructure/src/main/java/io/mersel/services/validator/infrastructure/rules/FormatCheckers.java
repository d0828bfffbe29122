package io.mersel.services.validator.infrastructure.rules;

import java.math.BigInteger;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.text.ParsePosition;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Durumsuz format denetleyicileri.
 * <p>
 * Telefon, posta kodu, milli kod, banka kartı, IBAN ve Celali tarih gibi
 * biçimleri regex ve sağlama toplamı algoritmalarıyla doğrular.
 * Tüm metotlar {@code null} girdi için {@code false} döner.
 */
public final class FormatCheckers {

    private FormatCheckers() {}

    private static final Pattern USERNAME = Pattern.compile("^[a-zA-Z0-9_]+$");
    private static final Pattern IRANIAN_PHONE = Pattern.compile("^0[1-9][0-9]{9}$");
    private static final Pattern IRANIAN_MOBILE = Pattern.compile("^09[0-9]{9}$");
    private static final Pattern TEN_DIGITS = Pattern.compile("^[0-9]{10}$");
    private static final Pattern ID_NUMBER = Pattern.compile("^[0-9]{1,10}$");
    private static final Pattern SIXTEEN_DIGITS = Pattern.compile("^[0-9]{16}$");
    private static final Pattern IRANIAN_IBAN = Pattern.compile("^IR[0-9]{24}$");
    private static final Pattern IPV4 = Pattern.compile(
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");
    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9A-Fa-f:.]+$");

    /** "IR" harflerinin MOD 97 için sayısal karşılığı (I=18, R=27). */
    private static final String IR_NUMERIC = "1827";
    private static final BigInteger NINETY_SEVEN = BigInteger.valueOf(97);

    /** 33 yıllık Celali döngüsünde artık yılların kalanları. */
    private static final Set<Integer> JALAALI_LEAP_REMAINDERS = Set.of(1, 5, 9, 13, 17, 22, 26, 30);

    /** Sıfır genişlikli birleştirmeyen karakter (ZWNJ). Farsça yazımda kelime içinde kullanılır. */
    private static final int ZWNJ = 0x200C;

    public static final String DEFAULT_JALAALI_LAYOUT = "uuuu-MM-dd'T'HH:mm:ssXXX";

    // ── Kullanıcı adı ve alfanümerik ─────────────────────────────────

    public static boolean isValidUsername(String username) {
        return username != null && USERNAME.matcher(username).matches();
    }

    /**
     * Yalnızca İngilizce harf ve rakam (ve verilen ek karakterler) içerip içermediğini kontrol eder.
     */
    public static boolean isAlphaNumeric(String value, List<String> extraChars) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        return value.codePoints().allMatch(cp -> isAsciiLetterOrDigit(cp) || isExtra(cp, extraChars));
    }

    /**
     * İngilizce ve Farsça harf/rakam (ve verilen ek karakterler) içerip içermediğini kontrol eder.
     */
    public static boolean isAlphaNumericWithPersian(String value, List<String> extraChars) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        return value.codePoints().allMatch(cp ->
                isAsciiLetterOrDigit(cp) || isPersianLetterOrDigit(cp) || isExtra(cp, extraChars));
    }

    // ── İran telefon ve kod biçimleri ────────────────────────────────

    public static boolean isValidIranianPhone(String phone) {
        return phone != null && IRANIAN_PHONE.matcher(phone).matches();
    }

    public static boolean isValidIranianMobile(String mobile) {
        return mobile != null && IRANIAN_MOBILE.matcher(mobile).matches();
    }

    public static boolean isValidIranianPostalCode(String postalCode) {
        return postalCode != null && TEN_DIGITS.matcher(postalCode).matches();
    }

    /**
     * Nüfus cüzdanı (doğum belgesi) numarası: 1-10 hane.
     */
    public static boolean isValidIranianIdNumber(String id) {
        return id != null && ID_NUMBER.matcher(id).matches();
    }

    /**
     * İran milli kodunu resmi sağlama algoritmasıyla doğrular.
     * <p>
     * İlk 9 hane 10'dan 2'ye kadar ağırlıklarla toplanır, toplamın 11'e bölümünden
     * kalan 2'den küçükse kontrol hanesi kalana, değilse {@code 11 - kalan}'a eşit olmalıdır.
     */
    public static boolean isValidIranianNationalCode(String nationalCode) {
        if (nationalCode == null || !TEN_DIGITS.matcher(nationalCode).matches()) {
            return false;
        }

        int sum = 0;
        for (int i = 0; i < 9; i++) {
            sum += Character.digit(nationalCode.charAt(i), 10) * (10 - i);
        }

        int remainder = sum % 11;
        int checkDigit = Character.digit(nationalCode.charAt(9), 10);

        return remainder < 2 ? checkDigit == remainder : checkDigit == 11 - remainder;
    }

    /**
     * 16 haneli banka kartı numarasını Luhn algoritmasıyla doğrular.
     */
    public static boolean isValidIranianBankCard(String cardNumber) {
        if (cardNumber == null || !SIXTEEN_DIGITS.matcher(cardNumber).matches()) {
            return false;
        }

        int sum = 0;
        boolean alternate = false;
        for (int i = cardNumber.length() - 1; i >= 0; i--) {
            int n = Character.digit(cardNumber.charAt(i), 10);
            if (alternate) {
                n *= 2;
                if (n > 9) {
                    n -= 9;
                }
            }
            sum += n;
            alternate = !alternate;
        }
        return sum % 10 == 0;
    }

    /**
     * İran IBAN numarasını ("IR" önekli veya öneksiz 24 hane) MOD 97 ile doğrular.
     */
    public static boolean isValidIranianIban(String iban) {
        if (iban == null) {
            return false;
        }
        String normalized = iban.startsWith("IR") ? iban : "IR" + iban;
        if (!IRANIAN_IBAN.matcher(normalized).matches()) {
            return false;
        }

        // Ülke kodu ve kontrol haneleri sona taşınır: BBAN + "IR" + kontrol
        String numeric = normalized.substring(4) + IR_NUMERIC + normalized.substring(2, 4);
        return new BigInteger(numeric).mod(NINETY_SEVEN).equals(BigInteger.ONE);
    }

    // ── Ağ adresleri ─────────────────────────────────────────────────

    /**
     * IPv4 veya IPv6 adres literali. Host adları kabul edilmez (DNS sorgusu yapılmaz).
     */
    public static boolean isValidIp(String ip) {
        if (ip == null || ip.isEmpty()) {
            return false;
        }
        if (IPV4.matcher(ip).matches()) {
            return true;
        }
        if (!ip.contains(":") || !IPV6_CHARS.matcher(ip).matches()) {
            return false;
        }
        try {
            // ':' içeren girdi IPv6 literali olarak ayrıştırılır, çözümleme yapılmaz
            InetAddress.getByName(ip);
            return true;
        } catch (UnknownHostException e) {
            return false;
        }
    }

    /**
     * {@code IP:port} biçimi. Tek ':' ayracı beklendiğinden IPv6 desteklenmez.
     */
    public static boolean isValidIpPort(String ipPort) {
        if (ipPort == null) {
            return false;
        }
        String[] parts = ipPort.split(":", -1);
        if (parts.length != 2 || !isValidIp(parts[0])) {
            return false;
        }
        try {
            int port = Integer.parseInt(parts[1]);
            return port >= 1 && port <= 65535;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    // ── Celali (Jalaali) takvim ──────────────────────────────────────

    /**
     * Celali tarih/saat değerini verilen {@link DateTimeFormatter} desenine göre doğrular.
     * <p>
     * Desen alanları çözümlenmeden okunur, ardından Celali takvim aralıklarıyla
     * kontrol edilir: ilk 6 ay 31, sonraki 5 ay 30 gün, Esfend artık yılda 30, diğerlerinde 29 gün.
     *
     * @param layout Desen; boşsa {@link #DEFAULT_JALAALI_LAYOUT}
     */
    public static boolean isValidJalaali(String value, String layout) {
        if (value == null || value.isBlank()) {
            return false;
        }

        DateTimeFormatter formatter;
        try {
            formatter = DateTimeFormatter.ofPattern(layout == null || layout.isBlank() ? DEFAULT_JALAALI_LAYOUT : layout);
        } catch (IllegalArgumentException e) {
            return false;
        }

        var position = new ParsePosition(0);
        TemporalAccessor parsed = formatter.parseUnresolved(value, position);
        if (parsed == null || position.getErrorIndex() >= 0 || position.getIndex() != value.length()) {
            return false;
        }

        Long year = field(parsed, ChronoField.YEAR);
        if (year == null) {
            year = field(parsed, ChronoField.YEAR_OF_ERA);
        }
        Long month = field(parsed, ChronoField.MONTH_OF_YEAR);
        Long day = field(parsed, ChronoField.DAY_OF_MONTH);
        if (year == null || month == null || day == null) {
            return false;
        }
        if (year < 1 || month < 1 || month > 12 || day < 1 || day > jalaaliMonthLength(year, month.intValue())) {
            return false;
        }

        for (ChronoField timeField : List.of(ChronoField.HOUR_OF_DAY, ChronoField.MINUTE_OF_HOUR,
                ChronoField.SECOND_OF_MINUTE, ChronoField.NANO_OF_SECOND)) {
            Long v = field(parsed, timeField);
            if (v != null && !timeField.range().isValidValue(v)) {
                return false;
            }
        }
        return true;
    }

    static boolean isJalaaliLeapYear(long year) {
        return JALAALI_LEAP_REMAINDERS.contains((int) Math.floorMod(year, 33L));
    }

    static int jalaaliMonthLength(long year, int month) {
        if (month <= 6) return 31;
        if (month <= 11) return 30;
        return isJalaaliLeapYear(year) ? 30 : 29;
    }

    // ── Yardımcılar ──────────────────────────────────────────────────

    private static Long field(TemporalAccessor parsed, ChronoField field) {
        return parsed.isSupported(field) ? parsed.getLong(field) : null;
    }

    private static boolean isAsciiLetterOrDigit(int cp) {
        return (cp >= 'a' && cp <= 'z') || (cp >= 'A' && cp <= 'Z') || (cp >= '0' && cp <= '9');
    }

    private static boolean isPersianLetterOrDigit(int cp) {
        return cp == ZWNJ
                || (Character.UnicodeBlock.of(cp) == Character.UnicodeBlock.ARABIC && Character.isLetterOrDigit(cp));
    }

    private static boolean isExtra(int cp, List<String> extraChars) {
        return extraChars != null && extraChars.contains(new String(Character.toChars(cp)));
    }
}

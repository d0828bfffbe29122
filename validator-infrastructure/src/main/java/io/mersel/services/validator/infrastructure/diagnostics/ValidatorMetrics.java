package io.mersel.services.validator.infrastructure.diagnostics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Collection;

/**
 * Doğrulayıcı özel metrikleri.
 * <p>
 * Prometheus üzerinden dışa aktarılır. Registry verilmezse tüm kayıtlar no-op olur.
 */
public class ValidatorMetrics {

    public static final String RESULT_VALID = "valid";
    public static final String RESULT_INVALID = "invalid";
    public static final String RESULT_ERROR = "error";

    private static final ValidatorMetrics NOOP = new ValidatorMetrics(null);

    private final MeterRegistry registry;

    public ValidatorMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public static ValidatorMetrics noop() {
        return NOOP;
    }

    /**
     * Doğrulama çağrısını kaydet.
     *
     * @param entry    Giriş noktası (struct, struct_except, struct_partial, var, var_with_value)
     * @param result   {@link #RESULT_VALID}, {@link #RESULT_INVALID} veya {@link #RESULT_ERROR}
     * @param duration Doğrulama süresi
     */
    public void recordValidation(String entry, String result, Duration duration) {
        if (registry == null) {
            return;
        }

        Counter.builder("validator_validations_total")
                .tag("entry", entry)
                .tag("result", result)
                .description("Doğrulama çağrı sayısı")
                .register(registry)
                .increment();

        Timer.builder("validator_validation_duration_seconds")
                .tag("entry", entry)
                .description("Doğrulama süresi")
                .register(registry)
                .record(duration);
    }

    /**
     * Başarısız olan kuralları kaydet.
     */
    public void recordViolations(Collection<String> rules) {
        if (registry == null || rules == null) {
            return;
        }
        for (String rule : rules) {
            Counter.builder("validator_violations_total")
                    .tag("rule", rule)
                    .description("Kural ihlali sayısı")
                    .register(registry)
                    .increment();
        }
    }
}

package io.mersel.services.validator.infrastructure.engine;

/**
 * Kural ifadesindeki tek bir kural çağrısı ({@code min=3} → name="min", param="3").
 */
record RuleCall(String name, String param) {
}
